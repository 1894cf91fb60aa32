package tech.simplekanban.platform.board.mapper;

import tech.simplekanban.platform.board.Board;
import tech.simplekanban.platform.board.entity.BoardEntity;

/**
 * Mapper from board entities to the ownership view.
 */
public final class BoardMapper {

    private BoardMapper() {
    }

    public static Board toDomain(BoardEntity entity) {
        if (entity == null) {
            return null;
        }

        Board board = new Board();
        board.id = entity.id;
        board.name = entity.name;
        board.description = entity.description;
        board.ownerId = entity.ownerId;
        board.groupId = entity.groupId;
        board.createdBy = entity.createdBy;
        board.createdAt = entity.createdAt;
        board.updatedAt = entity.updatedAt;
        return board;
    }
}
