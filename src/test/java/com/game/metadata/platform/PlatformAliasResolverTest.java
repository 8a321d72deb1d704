package com.game.metadata.platform;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlatformAliasResolver Tests")
class PlatformAliasResolverTest {

    private static final String OWNER = "user-1";

    private InMemoryPlatformRepository repository;
    private PlatformAliasResolver resolver;

    @BeforeEach
    void setUp() {
        repository = new InMemoryPlatformRepository();
        resolver = new PlatformAliasResolver(repository);
    }

    @Nested
    @DisplayName("Built-in table")
    class BuiltInTests {

        @ParameterizedTest(name = "''{0}'' -> ''{1}''")
        @CsvSource({
                "'  ps5  ', PlayStation 5",
                "PS4, PlayStation 4",
                "psx, PlayStation",
                "XSX, Xbox Series X|S",
                "xbone, Xbox One",
                "Switch, Nintendo Switch",
                "new 3ds, Nintendo 3DS",
                "nds, Nintendo DS",
                "wiiu, Nintendo Wii U",
                "ngc, Nintendo GameCube",
                "SNES, Super Nintendo",
                "macOS, PC",
                "Android, Mobile",
                "physical, Physical Only"
        })
        void normalizesKnownNames(String input, String expected) {
            assertEquals(expected, PlatformAliasResolver.normalizePlatformName(input));
        }

        @Test
        @DisplayName("Unknown names are returned trimmed and unchanged")
        void unknownNames() {
            assertEquals("Atari Jaguar", PlatformAliasResolver.normalizePlatformName("  Atari Jaguar "));
            assertEquals("", PlatformAliasResolver.normalizePlatformName(null));
        }

        @Test
        @DisplayName("Bare PlayStation stays the original console")
        void barePlayStation() {
            assertEquals("PlayStation", PlatformAliasResolver.normalizePlatformName("playstation"));
        }

        @Test
        @DisplayName("Every key of the table is lower case and trimmed")
        void tableKeys() {
            DefaultPlatformAliases.asMap().keySet().forEach(key -> {
                assertEquals(key.trim().toLowerCase(), key);
            });
        }
    }

    @Nested
    @DisplayName("User platforms")
    class UserPlatformTests {

        @Test
        @DisplayName("A user's platform name wins over the built-in table")
        void userNameFirst() {
            assertEquals("Nintendo Switch", resolver.resolve(OWNER, "switch"));

            repository.save(Platform.create(OWNER, "Switch", null, false, null));

            assertEquals("Switch", resolver.resolve(OWNER, "switch"));
            assertEquals("Switch", resolver.resolve(OWNER, " SWITCH "));
            assertEquals("Nintendo Switch", resolver.resolve("someone-else", "switch"));
        }

        @Test
        @DisplayName("A user alias wins over the built-in table")
        void userAliasBeforeTable() {
            repository.save(Platform.create(OWNER, "Steam Deck", null, false, "deck,linux"));
            assertEquals("Steam Deck", resolver.resolve(OWNER, " LINUX "));
            assertEquals("PC", resolver.resolve("someone-else", "linux"));
        }

        @Test
        @DisplayName("Exact names are matched before aliases")
        void namesBeforeAliases() {
            repository.save(Platform.create(OWNER, "Retro", null, false, "Arcade"));
            repository.save(Platform.create(OWNER, "Arcade", null, false, null));
            assertEquals("Arcade", resolver.resolve(OWNER, "arcade"));
        }

        @Test
        @DisplayName("Null and blank input")
        void blankInput() {
            assertEquals("", resolver.resolve(OWNER, null));
            assertEquals("", resolver.resolve(OWNER, "   "));
            assertTrue(resolver.resolvePlatform(OWNER, " ").isEmpty());
        }

        @Test
        @DisplayName("resolvePlatform finds the stored platform")
        void resolvePlatform() {
            Platform switchPlatform = repository.save(Platform.create(OWNER, "Nintendo Switch", null, true,
                    "Switch Lite,Switch OLED"));
            assertEquals(switchPlatform.id(), resolver.resolvePlatform(OWNER, "ns").orElseThrow().id());
            assertTrue(resolver.resolvePlatform(OWNER, "ps5").isEmpty());
        }
    }
}
