package tech.simplekanban.platform.board.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.simplekanban.platform.board.Board;
import tech.simplekanban.platform.board.BoardRepository;
import tech.simplekanban.platform.board.entity.BoardEntity;
import tech.simplekanban.platform.board.mapper.BoardMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of BoardRepository.
 */
@ApplicationScoped
@Transactional
public class PanacheBoardRepository implements BoardRepository, PanacheRepositoryBase<BoardEntity, String> {

    @Override
    public Optional<Board> findBoardById(String id) {
        return Optional.ofNullable(BoardMapper.toDomain(findById(id)));
    }

    @Override
    public int unlinkGroup(String groupId) {
        return update("groupId = null, updatedAt = ?1 WHERE groupId = ?2", Instant.now(), groupId);
    }
}
