package com.game.metadata.platform;

import com.game.metadata.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlatformService Tests")
class PlatformServiceTest {

    private static final String OWNER = "user-1";

    private InMemoryPlatformRepository platforms;
    private InMemoryGameReleaseRepository releases;
    private SimpleMeterRegistry registry;
    private PlatformService service;

    @BeforeEach
    void setUp() {
        platforms = new InMemoryPlatformRepository();
        releases = new InMemoryGameReleaseRepository();
        registry = new SimpleMeterRegistry();
        service = new PlatformService(platforms, releases, new MicrometerMetricsService(registry));
    }

    private static List<String> names(List<Platform> list) {
        return list.stream().map(Platform::name).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Seeds the default platforms once")
        void seedsOnce() {
            service.ensureDefaultPlatforms(OWNER);
            service.ensureDefaultPlatforms(OWNER);

            List<Platform> all = service.getAllPlatforms(OWNER);
            assertEquals(DefaultPlatforms.ALL.size(), all.size());
            assertTrue(all.stream().allMatch(Platform::isDefault));
            Platform nintendo = platforms.findByName(OWNER, "Nintendo Switch").orElseThrow();
            assertEquals(List.of("Switch Lite", "Switch OLED"), nintendo.aliasList());
        }

        @Test
        @DisplayName("Lists defaults first, then custom platforms by name")
        void ordering() {
            service.ensureDefaultPlatforms(OWNER);
            service.createPlatform(OWNER, "steam deck", null);
            service.createPlatform(OWNER, "Arcade", null);

            List<String> names = names(service.getAllPlatforms(OWNER));
            assertEquals(List.of("Arcade", "steam deck"), names.subList(names.size() - 2, names.size()));
            assertEquals("Mobile", names.get(0));
        }

        @Test
        @DisplayName("Default platforms cannot be edited or deleted but can get aliases")
        void defaultsProtected() {
            service.ensureDefaultPlatforms(OWNER);
            Platform pc = platforms.findByName(OWNER, "PC").orElseThrow();

            IllegalStateException edit = assertThrows(IllegalStateException.class,
                    () -> service.updatePlatform(OWNER, pc.id(), "Computer", null));
            assertEquals("Cannot edit a default platform", edit.getMessage());
            IllegalStateException delete = assertThrows(IllegalStateException.class,
                    () -> service.deletePlatform(OWNER, pc.id()));
            assertEquals("Cannot delete a default platform", delete.getMessage());

            Platform updated = service.setAliases(OWNER, pc.id(), " Steam Deck , ,steam deck, Windows ");
            assertEquals("Steam Deck,Windows", updated.aliases());
        }
    }

    @Nested
    @DisplayName("Custom platforms")
    class CustomTests {

        @Test
        @DisplayName("Creates, renames and deletes")
        void lifecycle() {
            Platform arcade = service.createPlatform(OWNER, "  Arcade ", "  ");
            assertEquals("Arcade", arcade.name());
            assertNull(arcade.description());
            assertFalse(arcade.isDefault());

            Platform renamed = service.updatePlatform(OWNER, arcade.id(), "Arcade Cabinet", "Coin-op");
            assertEquals("Arcade Cabinet", renamed.name());
            assertEquals("Coin-op", renamed.description());

            Platform described = service.updatePlatform(OWNER, arcade.id(), null, "Cabinets");
            assertEquals("Arcade Cabinet", described.name());

            service.deletePlatform(OWNER, arcade.id());
            assertTrue(service.getPlatformById(OWNER, arcade.id()).isEmpty());
        }

        @Test
        @DisplayName("Names are unique per owner regardless of case")
        void uniqueNames() {
            Platform arcade = service.createPlatform(OWNER, "Arcade", null);
            service.createPlatform(OWNER, "Retro", null);

            IllegalArgumentException duplicate = assertThrows(IllegalArgumentException.class,
                    () -> service.createPlatform(OWNER, "ARCADE", null));
            assertEquals("Platform \"ARCADE\" already exists", duplicate.getMessage());
            assertThrows(IllegalArgumentException.class,
                    () -> service.updatePlatform(OWNER, arcade.id(), "retro", null));
            assertDoesNotThrow(() -> service.createPlatform("user-2", "Arcade", null));
        }

        @Test
        @DisplayName("A blank name is rejected")
        void blankName() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> service.createPlatform(OWNER, "  ", null));
            assertEquals("Platform name is required", e.getMessage());
        }

        @Test
        @DisplayName("Platforms of another owner are invisible")
        void otherOwner() {
            Platform arcade = service.createPlatform(OWNER, "Arcade", null);
            assertTrue(service.getPlatformById("user-2", arcade.id()).isEmpty());
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> service.deletePlatform("user-2", arcade.id()));
            assertEquals("Platform not found", e.getMessage());
        }
    }

    @Nested
    @DisplayName("getOrCreatePlatform")
    class GetOrCreateTests {

        @Test
        @DisplayName("Resolves aliases to an existing platform")
        void resolvesExisting() {
            service.ensureDefaultPlatforms(OWNER);
            Platform ps5 = service.getOrCreatePlatform(OWNER, "  ps5 ");
            assertEquals("PlayStation 5", ps5.name());
            assertTrue(ps5.isDefault());
            assertEquals(DefaultPlatforms.ALL.size(), platforms.size());
        }

        @Test
        @DisplayName("Creates the platform under its canonical name")
        void createsCanonical() {
            Platform gamecube = service.getOrCreatePlatform(OWNER, "ngc");
            assertEquals("Nintendo GameCube", gamecube.name());
            assertFalse(gamecube.isDefault());
            assertSame(gamecube, service.getOrCreatePlatform(OWNER, "GameCube"));
        }

        @Test
        @DisplayName("Unknown names are created as typed")
        void createsUnknown() {
            assertEquals("Atari Lynx", service.getOrCreatePlatform(OWNER, " Atari Lynx ").name());
            assertEquals("Atari Lynx", service.resolvePlatformName(OWNER, "atari lynx"));
        }
    }

    @Nested
    @DisplayName("mergePlatforms")
    class MergeTests {

        private Platform target;
        private Platform source;

        @BeforeEach
        void setUpPlatforms() {
            service.ensureDefaultPlatforms(OWNER);
            target = platforms.findByName(OWNER, "Nintendo Switch").orElseThrow();
            source = service.createPlatform(OWNER, "Switch 2", null);
            source = service.setAliases(OWNER, source.id(), "NS2,switch lite,Nintendo Switch");
            releases.save(new GameRelease("r1", "title-1", source.id()));
            releases.save(new GameRelease("r2", "title-2", source.id()));
            releases.save(new GameRelease("r3", "title-3", target.id()));
        }

        @Test
        @DisplayName("Moves releases, carries names over and deletes the source")
        void merges() {
            PlatformMergeResult result = service.mergePlatforms(OWNER, source.id(), target.id());

            assertEquals(2, result.releasesMoved());
            assertEquals(source.id(), result.removedId());
            assertEquals(List.of("Switch 2", "NS2"), result.aliasesAdded());
            assertEquals(List.of("Switch Lite", "Switch OLED", "Switch 2", "NS2"), result.target().aliasList());

            assertTrue(platforms.findById(source.id()).isEmpty());
            assertEquals(3, releases.findByPlatform(target.id()).size());
            assertEquals("Nintendo Switch", service.resolvePlatformName(OWNER, "ns2"));
            assertEquals(1.0, registry.find("metadata.platform.merged").counter().count());
        }

        @Test
        @DisplayName("Values the target already answers to are skipped but still resolve to it")
        void skipsKnownValues() {
            PlatformMergeResult result = service.mergePlatforms(OWNER, source.id(), target.id());

            Platform merged = result.target();
            assertFalse(merged.aliasList().stream().anyMatch(a -> a.equalsIgnoreCase("Nintendo Switch")));
            assertEquals(1, merged.aliasList().stream().filter(a -> a.equalsIgnoreCase("switch lite")).count());
            assertEquals("Nintendo Switch", service.resolvePlatformName(OWNER, "nintendo switch"));
            assertEquals("Nintendo Switch", service.resolvePlatformName(OWNER, "SWITCH LITE"));
            assertEquals("Nintendo Switch", service.resolvePlatformName(OWNER, "switch 2"));
        }

        @Test
        @DisplayName("Rejects self merges, defaults as source and missing platforms")
        void rejectsInvalid() {
            IllegalArgumentException self = assertThrows(IllegalArgumentException.class,
                    () -> service.mergePlatforms(OWNER, target.id(), target.id()));
            assertEquals("Cannot merge a platform into itself", self.getMessage());

            Platform pc = platforms.findByName(OWNER, "PC").orElseThrow();
            IllegalStateException fromDefault = assertThrows(IllegalStateException.class,
                    () -> service.mergePlatforms(OWNER, pc.id(), source.id()));
            assertEquals("Cannot merge a default platform. Merge custom platforms instead.", fromDefault.getMessage());

            assertEquals("Source platform not found", assertThrows(IllegalArgumentException.class,
                    () -> service.mergePlatforms(OWNER, "missing", target.id())).getMessage());
            assertEquals("Target platform not found", assertThrows(IllegalArgumentException.class,
                    () -> service.mergePlatforms(OWNER, source.id(), "missing")).getMessage());
            assertEquals("Source platform not found", assertThrows(IllegalArgumentException.class,
                    () -> service.mergePlatforms("user-2", source.id(), target.id())).getMessage());
        }

        @Test
        @DisplayName("A failing step leaves every record as it was")
        void rollsBack() {
            InMemoryPlatformRepository failingDeletes = new InMemoryPlatformRepository() {
                @Override
                public synchronized void delete(String id) {
                    throw new IllegalStateException("store unavailable");
                }
            };
            platforms.findByOwner(OWNER).forEach(failingDeletes::save);
            PlatformService failing = new PlatformService(failingDeletes, releases);

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> failing.mergePlatforms(OWNER, source.id(), target.id()));
            assertEquals("store unavailable", e.getMessage());

            assertEquals(target.aliases(), failingDeletes.findById(target.id()).orElseThrow().aliases());
            assertTrue(failingDeletes.findById(source.id()).isPresent());
            assertEquals(2, releases.findByPlatform(source.id()).size());
            assertEquals(List.of("r3"), releases.findByPlatform(target.id()).stream()
                    .map(GameRelease::id).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("A failing repoint restores the target aliases")
        void rollsBackRepoint() {
            InMemoryGameReleaseRepository failingRepoint = new InMemoryGameReleaseRepository() {
                @Override
                public synchronized int repointPlatform(String fromPlatformId, String toPlatformId) {
                    throw new IllegalStateException("release store unavailable");
                }
            };
            PlatformService failing = new PlatformService(platforms, failingRepoint);

            assertThrows(IllegalStateException.class, () -> failing.mergePlatforms(OWNER, source.id(), target.id()));

            assertEquals("Switch Lite,Switch OLED", platforms.findById(target.id()).orElseThrow().aliases());
            assertTrue(platforms.findById(source.id()).isPresent());
        }
    }
}
