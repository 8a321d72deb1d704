package com.game.metadata.platform;

import com.game.metadata.logging.LogContext;
import com.game.metadata.metrics.MetricsService;
import com.game.metadata.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Platform lifecycle for one user's catalog: default seeding, custom platforms, aliases
 * and merges.
 */
public class PlatformService {
    private static final Logger log = LoggerFactory.getLogger(PlatformService.class);

    private final PlatformRepository platformRepository;
    private final GameReleaseRepository releaseRepository;
    private final PlatformAliasResolver aliasResolver;
    private final MetricsService metrics;

    public PlatformService(PlatformRepository platformRepository, GameReleaseRepository releaseRepository) {
        this(platformRepository, releaseRepository, new NoOpMetricsService());
    }

    public PlatformService(PlatformRepository platformRepository, GameReleaseRepository releaseRepository,
                           MetricsService metrics) {
        this.platformRepository = Objects.requireNonNull(platformRepository, "platformRepository is required");
        this.releaseRepository = Objects.requireNonNull(releaseRepository, "releaseRepository is required");
        this.aliasResolver = new PlatformAliasResolver(platformRepository);
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Seeds any missing default platforms. Safe to call repeatedly.
     */
    public void ensureDefaultPlatforms(String ownerId) {
        for (DefaultPlatforms.Definition definition : DefaultPlatforms.ALL) {
            if (platformRepository.findByName(ownerId, definition.name()).isEmpty()) {
                platformRepository.save(Platform.create(ownerId, definition.name(), definition.description(),
                        true, definition.aliases()));
                log.debug("platform.default.created owner={} name='{}'", ownerId, definition.name());
            }
        }
    }

    /**
     * Default platforms first, then by name.
     */
    public List<Platform> getAllPlatforms(String ownerId) {
        return platformRepository.findByOwner(ownerId);
    }

    public Optional<Platform> getPlatformById(String ownerId, String id) {
        return platformRepository.findById(id).filter(p -> p.ownerId().equals(ownerId));
    }

    public Platform createPlatform(String ownerId, String name, String description) {
        String trimmed = requireName(name);
        if (platformRepository.findByName(ownerId, trimmed).isPresent()) {
            throw new IllegalArgumentException("Platform \"" + trimmed + "\" already exists");
        }
        Platform platform = platformRepository.save(
                Platform.create(ownerId, trimmed, blankToNull(description), false, null));
        log.info("platform.created owner={} id={} name='{}'", ownerId, platform.id(), platform.name());
        return platform;
    }

    /**
     * Renames or re-describes a custom platform. A null name keeps the current one.
     */
    public Platform updatePlatform(String ownerId, String id, String name, String description) {
        Platform platform = require(ownerId, id, "Platform not found");
        if (platform.isDefault()) {
            throw new IllegalStateException("Cannot edit a default platform");
        }
        String newName = name != null ? requireName(name) : platform.name();
        if (!newName.equals(platform.name())) {
            Optional<Platform> clash = platformRepository.findByName(ownerId, newName);
            if (clash.isPresent() && !clash.get().id().equals(id)) {
                throw new IllegalArgumentException("Platform \"" + newName + "\" already exists");
            }
        }
        String newDescription = description != null ? blankToNull(description) : platform.description();
        return platformRepository.save(platform.withName(newName, newDescription));
    }

    public void deletePlatform(String ownerId, String id) {
        Platform platform = require(ownerId, id, "Platform not found");
        if (platform.isDefault()) {
            throw new IllegalStateException("Cannot delete a default platform");
        }
        platformRepository.delete(id);
        log.info("platform.deleted owner={} id={} name='{}'", ownerId, id, platform.name());
    }

    /**
     * Replaces a platform's aliases. Allowed on default platforms too. The list is
     * normalized; a null or blank list clears the aliases.
     */
    public Platform setAliases(String ownerId, String id, String aliases) {
        Platform platform = require(ownerId, id, "Platform not found");
        return platformRepository.save(platform.withAliases(Platform.joinAliases(Platform.splitAliases(aliases))));
    }

    /**
     * Resolves a raw name through {@link PlatformAliasResolver} and returns the matching
     * platform, creating it under the resolved name when the user has none.
     */
    public Platform getOrCreatePlatform(String ownerId, String rawName) {
        String resolved = aliasResolver.resolve(ownerId, requireName(rawName));
        return platformRepository.findByName(ownerId, resolved)
                .orElseGet(() -> {
                    Platform created = platformRepository.save(Platform.create(ownerId, resolved, null, false, null));
                    log.info("platform.created owner={} id={} name='{}' input='{}'",
                            ownerId, created.id(), created.name(), rawName.trim());
                    return created;
                });
    }

    public String resolvePlatformName(String ownerId, String rawName) {
        return aliasResolver.resolve(ownerId, rawName);
    }

    /**
     * Merges {@code sourceId} into {@code targetId}: the target gains the source's name and
     * aliases, every release of the source moves to the target, and the source is deleted.
     * Either all three steps take effect or none does.
     * <p>
     * A source name or alias that already matches the target's name or one of its aliases,
     * ignoring case, is not added again. Such a value still resolves to the target, by name
     * before any alias, so nothing that resolved to the source is lost.
     *
     * @throws IllegalArgumentException if either platform is missing, foreign, or they are the same
     * @throws IllegalStateException    if the source is a default platform
     */
    public PlatformMergeResult mergePlatforms(String ownerId, String sourceId, String targetId) {
        if (Objects.equals(sourceId, targetId)) {
            throw new IllegalArgumentException("Cannot merge a platform into itself");
        }
        Platform source = require(ownerId, sourceId, "Source platform not found");
        Platform target = require(ownerId, targetId, "Target platform not found");
        if (source.isDefault()) {
            throw new IllegalStateException("Cannot merge a default platform. Merge custom platforms instead.");
        }

        try (LogContext ctx = LogContext.forPlatformMerge(LogContext.generateCorrelationId(), sourceId, targetId);
             PlatformMergeTransaction tx = new PlatformMergeTransaction()) {

            List<String> merged = new ArrayList<>(target.aliasList());
            List<String> added = new ArrayList<>();
            List<String> candidates = new ArrayList<>(source.aliasList());
            candidates.add(0, source.name());
            for (String alias : candidates) {
                if (!target.hasName(alias) && !target.hasAlias(alias) && !containsIgnoreCase(added, alias)) {
                    merged.add(alias);
                    added.add(alias);
                }
            }
            Platform updatedTarget = target.withAliases(Platform.joinAliases(merged));

            tx.execute("update target aliases",
                    () -> platformRepository.save(updatedTarget),
                    () -> platformRepository.save(target));

            List<String> movedIds = releaseRepository.findByPlatform(sourceId).stream()
                    .map(GameRelease::id)
                    .collect(Collectors.toList());
            AtomicInteger moved = new AtomicInteger();
            tx.execute("repoint releases",
                    () -> moved.set(releaseRepository.repointPlatform(sourceId, targetId)),
                    () -> releaseRepository.assignPlatform(movedIds, sourceId));

            tx.execute("delete source platform",
                    () -> platformRepository.delete(sourceId),
                    () -> platformRepository.save(source));

            tx.markSuccess();
            metrics.incrementPlatformMerged();
            log.info("platform.merged owner={} source='{}' target='{}' releasesMoved={} aliasesAdded={}",
                    ownerId, source.name(), target.name(), moved.get(), added);
            return new PlatformMergeResult(updatedTarget, sourceId, moved.get(), added);
        }
    }

    private Platform require(String ownerId, String id, String message) {
        return getPlatformById(ownerId, id).orElseThrow(() -> new IllegalArgumentException(message));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Platform name is required");
        }
        return name.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(candidate));
    }
}
