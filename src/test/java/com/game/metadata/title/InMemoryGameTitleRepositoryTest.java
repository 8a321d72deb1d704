package com.game.metadata.title;

import com.game.metadata.provider.TitleDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Game title storage Tests")
class InMemoryGameTitleRepositoryTest {

    private final InMemoryGameTitleRepository repository = new InMemoryGameTitleRepository();

    @Test
    @DisplayName("Should apply only the fields present in a patch")
    void appliesPatch() {
        repository.save(GameTitle.builder().id("t-1").name("Catan").type(TitleType.BOARD_GAME)
                .description("Old").supportsPhysical(true).physicalMinPlayers(3).physicalMaxPlayers(4).build());

        repository.applyUpdate("t-1", new TitleUpdate()
                .set(TitleField.DESCRIPTION, "Trade and build.")
                .clear(TitleField.PHYSICAL_MIN_PLAYERS));

        GameTitle stored = repository.findById("t-1").orElseThrow();
        assertEquals("Trade and build.", stored.getDescription());
        assertNull(stored.getPhysicalMinPlayers());
        assertEquals(4, stored.getPhysicalMaxPlayers());
        assertEquals(TitleType.BOARD_GAME, stored.getType());
    }

    @Test
    @DisplayName("Should reject a patch for an unknown title")
    void unknownTitle() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> repository.applyUpdate("missing", new TitleUpdate()));

        assertEquals("Game title not found: missing", e.getMessage());
    }

    @Test
    @DisplayName("Should reject values of the wrong type")
    void typedFields() {
        TitleUpdate update = new TitleUpdate();

        assertThrows(IllegalArgumentException.class, () -> update.set(TitleField.ONLINE_MAX_PLAYERS, "four"));
        assertTrue(update.isEmpty());
    }

    @Test
    @DisplayName("Should default the type and require id and name")
    void builderDefaults() {
        GameTitle title = GameTitle.builder().id("t-1").name("Portal 2").build();

        assertEquals(TitleType.VIDEO_GAME, title.getType());
        assertThrows(NullPointerException.class, () -> GameTitle.builder().name("No id").build());
        assertThrows(IllegalArgumentException.class,
                () -> repository.save(GameTitle.builder().id(" ").name("Blank").build()));
    }

    @ParameterizedTest
    @CsvSource({
            "board_game, BOARD_GAME, TABLETOP",
            "CARD_GAME, CARD_GAME, TABLETOP",
            "' tabletop_rpg ', TABLETOP_RPG, TABLETOP",
            "other_physical_game, OTHER_PHYSICAL_GAME, TABLETOP",
            "video_game, VIDEO_GAME, VIDEO_GAME",
            "arcade_cabinet, VIDEO_GAME, VIDEO_GAME"
    })
    @DisplayName("Should parse stored type labels")
    void parsesLabels(String label, TitleType expected, TitleDomain domain) {
        TitleType type = TitleType.fromLabel(label);

        assertEquals(expected, type);
        assertEquals(domain, type.getDomain());
        assertEquals(domain == TitleDomain.TABLETOP, type.isTabletop());
    }
}
