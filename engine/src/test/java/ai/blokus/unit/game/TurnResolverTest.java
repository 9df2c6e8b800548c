package ai.blokus.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.blokus.game.Board;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.PlayerMode;
import ai.blokus.game.TurnAdvance;
import ai.blokus.game.TurnResolver;
import ai.blokus.game.UsedPieces;
import ai.blokus.unit.helpers.BoardBuilder;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Turn order, skipping colors without moves, and the neutral holder pointer.
 */
@DisplayName("TurnResolver")
class TurnResolverTest {
    private static final Set<PlayerColor> ALL_PENDING = EnumSet.allOf(PlayerColor.class);
    private static final Set<PlayerColor> NONE_OUT = EnumSet.noneOf(PlayerColor.class);

    private final TurnResolver fourParty = new TurnResolver(PlayerMode.FOUR_PARTY);
    private final TurnResolver threeParty = new TurnResolver(PlayerMode.THREE_PARTY);

    @Test
    void nextColorInCyclicOrder() {
        TurnAdvance advance = fourParty.advance(
                PlayerColor.BLUE, Board.empty(), UsedPieces.none(), ALL_PENDING, NONE_OUT, 0);

        assertEquals(PlayerColor.RED, advance.nextColor());
        assertFalse(advance.terminal());
        assertTrue(advance.skipped().isEmpty());
        assertTrue(advance.out().isEmpty());
    }

    @Test
    void wrapsFromYellowToBlue() {
        TurnAdvance advance = fourParty.advance(
                PlayerColor.YELLOW, Board.empty(), UsedPieces.none(), ALL_PENDING, NONE_OUT, 0);
        assertEquals(PlayerColor.BLUE, advance.nextColor());
    }

    @Test
    void colorWithoutMovesIsSkippedAndMarkedOut() {
        // Red's corner is taken, so Red can never open.
        Board board = BoardBuilder.emptyBoard().cell(0, 19, PlayerColor.BLUE).build();

        TurnAdvance advance = fourParty.advance(
                PlayerColor.BLUE, board, UsedPieces.none(), ALL_PENDING, NONE_OUT, 0);

        assertEquals(PlayerColor.GREEN, advance.nextColor());
        assertEquals(List.of(PlayerColor.RED), advance.skipped());
        assertEquals(EnumSet.of(PlayerColor.RED), advance.out());
    }

    @Test
    void outIsStickyEvenWhenMovesReappear() {
        TurnAdvance advance = fourParty.advance(
                PlayerColor.BLUE, Board.empty(), UsedPieces.none(), ALL_PENDING, EnumSet.of(PlayerColor.RED), 0);

        assertEquals(PlayerColor.GREEN, advance.nextColor());
        assertTrue(advance.skipped().isEmpty());
        assertTrue(advance.out().contains(PlayerColor.RED));
        assertTrue(advance.toTurnState().isOut(PlayerColor.RED));
    }

    @Test
    void allColorsStuckIsTerminal() {
        Board full = BoardBuilder.filledWith(PlayerColor.GREEN).build();

        TurnAdvance advance = fourParty.advance(
                PlayerColor.BLUE, full, UsedPieces.none(), NONE_OUT, NONE_OUT, 0);

        assertTrue(advance.terminal());
        assertEquals(PlayerColor.BLUE, advance.nextColor());
        assertEquals(List.of(PlayerColor.RED, PlayerColor.GREEN, PlayerColor.YELLOW, PlayerColor.BLUE),
                advance.skipped());
        assertEquals(EnumSet.allOf(PlayerColor.class), advance.out());
        assertTrue(advance.toTurnState().terminal());
    }

    @Test
    void lastColorStandingKeepsTheTurn() {
        Board board = BoardBuilder.emptyBoard().cell(0, 0, PlayerColor.BLUE).build();
        Set<PlayerColor> out = EnumSet.of(PlayerColor.RED, PlayerColor.GREEN, PlayerColor.YELLOW);

        TurnAdvance advance = fourParty.advance(
                PlayerColor.BLUE, board, UsedPieces.none(), EnumSet.noneOf(PlayerColor.class), out, 0);

        assertFalse(advance.terminal());
        assertEquals(PlayerColor.BLUE, advance.nextColor());
    }

    @Test
    void inputOutSetIsNotModified() {
        Board board = BoardBuilder.emptyBoard().cell(0, 19, PlayerColor.BLUE).build();
        Set<PlayerColor> out = EnumSet.noneOf(PlayerColor.class);

        fourParty.advance(PlayerColor.BLUE, board, UsedPieces.none(), ALL_PENDING, out, 0);

        assertTrue(out.isEmpty());
    }

    @Nested
    @DisplayName("Neutral holder")
    class NeutralHolderTests {

        @Test
        void playingTheNeutralColorMovesThePointer() {
            TurnAdvance advance = threeParty.advance(
                    PlayerColor.YELLOW, Board.empty(), UsedPieces.none(), ALL_PENDING, NONE_OUT, 0);

            assertEquals(PlayerColor.BLUE, advance.nextColor());
            assertEquals(1, advance.neutralHolder());
        }

        @Test
        void pointerWrapsAroundThePartyCount() {
            TurnAdvance advance = threeParty.advance(
                    PlayerColor.YELLOW, Board.empty(), UsedPieces.none(), ALL_PENDING, NONE_OUT, 2);
            assertEquals(0, advance.neutralHolder());
        }

        @Test
        void stoppingOnTheNeutralColorLeavesThePointer() {
            TurnAdvance advance = threeParty.advance(
                    PlayerColor.GREEN, Board.empty(), UsedPieces.none(), ALL_PENDING, NONE_OUT, 1);

            assertEquals(PlayerColor.YELLOW, advance.nextColor());
            assertEquals(1, advance.neutralHolder());
        }

        @Test
        void skippingTheNeutralColorMovesThePointer() {
            Board board = BoardBuilder.emptyBoard().cell(19, 0, PlayerColor.GREEN).build();

            TurnAdvance advance = threeParty.advance(
                    PlayerColor.GREEN, board, UsedPieces.none(), ALL_PENDING, NONE_OUT, 1);

            assertEquals(PlayerColor.BLUE, advance.nextColor());
            assertEquals(List.of(PlayerColor.YELLOW), advance.skipped());
            assertEquals(2, advance.neutralHolder());
        }

        @Test
        void passingOverAnOutNeutralColorStillMovesThePointer() {
            TurnAdvance advance = threeParty.advance(
                    PlayerColor.GREEN, Board.empty(), UsedPieces.none(), ALL_PENDING, EnumSet.of(PlayerColor.YELLOW), 0);

            assertEquals(PlayerColor.BLUE, advance.nextColor());
            assertEquals(1, advance.neutralHolder());
        }

        @Test
        void pointerNeverMovesOutsideThreePartyGames() {
            TurnAdvance advance = fourParty.advance(
                    PlayerColor.YELLOW, Board.empty(), UsedPieces.none(), ALL_PENDING, NONE_OUT, 0);
            assertEquals(0, advance.neutralHolder());
        }
    }
}
