package ai.blokus.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.blokus.game.Alliance;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.PlayerMode;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PlayerMode")
class PlayerModeTest {

    @Test
    void resolvesFromPartyCount() {
        assertEquals(PlayerMode.TWO_PARTY, PlayerMode.forPartyCount(2));
        assertEquals(PlayerMode.THREE_PARTY, PlayerMode.forPartyCount(3));
        assertEquals(PlayerMode.FOUR_PARTY, PlayerMode.forPartyCount(4));
        assertThrows(IllegalArgumentException.class, () -> PlayerMode.forPartyCount(1));
        assertThrows(IllegalArgumentException.class, () -> PlayerMode.forPartyCount(5));
    }

    @Test
    void colorIdsAndTurnOrder() {
        assertEquals(PlayerColor.RED, PlayerColor.BLUE.next());
        assertEquals(PlayerColor.BLUE, PlayerColor.YELLOW.next());
        assertEquals(PlayerColor.GREEN, PlayerColor.fromId(2));
        assertThrows(IllegalArgumentException.class, () -> PlayerColor.fromId(4));
    }

    @Nested
    @DisplayName("Two parties")
    class TwoPartyTests {

        @Test
        void diagonalColorsShareAParty() {
            assertEquals(List.of(PlayerColor.BLUE, PlayerColor.GREEN), PlayerMode.TWO_PARTY.colorsOf(0));
            assertEquals(List.of(PlayerColor.RED, PlayerColor.YELLOW), PlayerMode.TWO_PARTY.colorsOf(1));
            assertEquals(0, PlayerMode.TWO_PARTY.controllingParty(PlayerColor.GREEN, 0));
            assertEquals(1, PlayerMode.TWO_PARTY.controllingParty(PlayerColor.YELLOW, 0));
            assertNull(PlayerMode.TWO_PARTY.neutralColor());
        }

        @Test
        void alliesAreThePartysColors() {
            Alliance alliance = PlayerMode.TWO_PARTY.alliance(PlayerColor.BLUE, 0);
            assertEquals(EnumSet.of(PlayerColor.BLUE, PlayerColor.GREEN), alliance.allies());
            assertEquals(EnumSet.of(PlayerColor.RED, PlayerColor.YELLOW), alliance.opponents());
            assertTrue(alliance.isAlly(PlayerColor.GREEN));
            assertTrue(alliance.isOpponent(PlayerColor.RED));
            assertFalse(alliance.isAlly(null));
        }
    }

    @Nested
    @DisplayName("Three parties")
    class ThreePartyTests {

        @Test
        void yellowIsNeutralAndFollowsTheHolder() {
            assertEquals(PlayerColor.YELLOW, PlayerMode.THREE_PARTY.neutralColor());
            assertTrue(PlayerMode.THREE_PARTY.isNeutral(PlayerColor.YELLOW));
            assertEquals(2, PlayerMode.THREE_PARTY.controllingParty(PlayerColor.YELLOW, 2));
            assertEquals(1, PlayerMode.THREE_PARTY.controllingParty(PlayerColor.RED, 2));
        }

        @Test
        void neutralColorAlliesWithItsHolder() {
            Alliance alliance = PlayerMode.THREE_PARTY.alliance(PlayerColor.YELLOW, 1);
            assertEquals(EnumSet.of(PlayerColor.RED, PlayerColor.YELLOW), alliance.allies());
            assertEquals(EnumSet.of(PlayerColor.BLUE, PlayerColor.GREEN), alliance.opponents());
        }

        @Test
        void ownedColorStandsAlone() {
            Alliance alliance = PlayerMode.THREE_PARTY.alliance(PlayerColor.BLUE, 0);
            assertEquals(EnumSet.of(PlayerColor.BLUE), alliance.allies());
            assertEquals(EnumSet.of(PlayerColor.RED, PlayerColor.GREEN, PlayerColor.YELLOW), alliance.opponents());
        }

        @Test
        void unknownPartyIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> PlayerMode.THREE_PARTY.colorsOf(3));
        }
    }

    @Test
    void fourPartiesOwnOneColorEach() {
        for (PlayerColor color : PlayerColor.values()) {
            assertEquals(color.id(), PlayerMode.FOUR_PARTY.controllingParty(color, 0));
            Alliance alliance = PlayerMode.FOUR_PARTY.alliance(color, 0);
            assertEquals(EnumSet.of(color), alliance.allies());
            assertEquals(3, alliance.opponents().size());
        }
    }
}
