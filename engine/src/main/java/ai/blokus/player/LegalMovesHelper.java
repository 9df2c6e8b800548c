package ai.blokus.player;

import ai.blokus.game.Board;
import ai.blokus.game.Move;
import ai.blokus.game.Piece;
import ai.blokus.game.PlacementValidator;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.Transformation;
import ai.blokus.game.UsedPieces;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates legal placements for a color.
 * <p>
 * Anchors are scanned over {@code [-OVERHANG, SIZE + OVERHANG)} on both axes. The anchor is the
 * bounding-box origin rather than a filled cell, so a shape whose first row or column is partly
 * empty can sit with its origin off the board while every filled cell is on it.
 */
public final class LegalMovesHelper {
    /** How far anchors may sit beyond each board edge. */
    public static final int OVERHANG = 4;

    private static final int ANCHOR_MIN = -OVERHANG;
    private static final int ANCHOR_MAX = Board.SIZE + OVERHANG;

    private LegalMovesHelper() {
    }

    /**
     * Return every legal placement for {@code color}.
     * <p>
     * Order is catalog order of the unused pieces, then orientation order, then row, then column.
     * An empty list is a normal outcome meaning the color cannot place anything right now.
     *
     * @param board       current board
     * @param color       the color to move
     * @param usedPieces  pieces already placed, per color
     * @param isFirstMove whether {@code color} still has to make its opening placement
     */
    public static List<Move> generateAllMoves(
            Board board, PlayerColor color, UsedPieces usedPieces, boolean isFirstMove) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(usedPieces, "usedPieces");

        List<Piece> available = usedPieces.available(color);
        if (available.isEmpty()) {
            return Collections.emptyList();
        }
        List<Move> moves = new ArrayList<>();
        for (Piece piece : available) {
            for (Transformation transformation : piece.transformations()) {
                for (int row = ANCHOR_MIN; row < ANCHOR_MAX; row++) {
                    for (int col = ANCHOR_MIN; col < ANCHOR_MAX; col++) {
                        if (PlacementValidator.validate(board, row, col, transformation.shape(), color, isFirstMove)
                                .isValid()) {
                            moves.add(new Move(piece, transformation, row, col));
                        }
                    }
                }
            }
        }
        return moves;
    }

    /**
     * Cheap existence check: does {@code color} have at least one legal placement?
     * <p>
     * Pieces are tried smallest first and the scan stops at the first hit. Every anchor is
     * visited, so a {@code false} answer is exact and may be used to mark a color out.
     */
    public static boolean hasAnyValidMove(
            Board board, PlayerColor color, UsedPieces usedPieces, boolean isFirstMove) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(usedPieces, "usedPieces");

        for (Piece piece : Piece.smallestFirst()) {
            if (usedPieces.contains(color, piece)) {
                continue;
            }
            for (Transformation transformation : piece.transformations()) {
                for (int row = ANCHOR_MIN; row < ANCHOR_MAX; row++) {
                    for (int col = ANCHOR_MIN; col < ANCHOR_MAX; col++) {
                        if (PlacementValidator.validate(board, row, col, transformation.shape(), color, isFirstMove)
                                .isValid()) {
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }
}
