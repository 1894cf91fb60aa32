package tech.simplekanban.platform.board;

import java.util.Optional;

/**
 * Repository interface for the ownership side of boards.
 */
public interface BoardRepository {

    Optional<Board> findBoardById(String id);

    /**
     * Detach every board from a group that is being deleted. Returns the number of boards orphaned.
     */
    int unlinkGroup(String groupId);
}
