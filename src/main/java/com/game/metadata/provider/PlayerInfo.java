package com.game.metadata.provider;

import java.util.Objects;

/**
 * Player counts overall and per play mode, with a support flag per mode.
 * Every field is nullable; {@code null} means the provider did not say, which is
 * different from a {@code false} flag.
 */
public final class PlayerInfo {
    private final Integer overallMinPlayers;
    private final Integer overallMaxPlayers;
    private final Boolean supportsOnline;
    private final Integer onlineMinPlayers;
    private final Integer onlineMaxPlayers;
    private final Boolean supportsLocal;
    private final Integer localMinPlayers;
    private final Integer localMaxPlayers;
    private final Boolean supportsPhysical;
    private final Integer physicalMinPlayers;
    private final Integer physicalMaxPlayers;

    private PlayerInfo(Builder builder) {
        this.overallMinPlayers = builder.overallMinPlayers;
        this.overallMaxPlayers = builder.overallMaxPlayers;
        this.supportsOnline = builder.supportsOnline;
        this.onlineMinPlayers = builder.onlineMinPlayers;
        this.onlineMaxPlayers = builder.onlineMaxPlayers;
        this.supportsLocal = builder.supportsLocal;
        this.localMinPlayers = builder.localMinPlayers;
        this.localMaxPlayers = builder.localMaxPlayers;
        this.supportsPhysical = builder.supportsPhysical;
        this.physicalMinPlayers = builder.physicalMinPlayers;
        this.physicalMaxPlayers = builder.physicalMaxPlayers;
    }

    public Integer getOverallMinPlayers() {
        return overallMinPlayers;
    }

    public Integer getOverallMaxPlayers() {
        return overallMaxPlayers;
    }

    public Boolean getSupportsOnline() {
        return supportsOnline;
    }

    public Integer getOnlineMinPlayers() {
        return onlineMinPlayers;
    }

    public Integer getOnlineMaxPlayers() {
        return onlineMaxPlayers;
    }

    public Boolean getSupportsLocal() {
        return supportsLocal;
    }

    public Integer getLocalMinPlayers() {
        return localMinPlayers;
    }

    public Integer getLocalMaxPlayers() {
        return localMaxPlayers;
    }

    public Boolean getSupportsPhysical() {
        return supportsPhysical;
    }

    public Integer getPhysicalMinPlayers() {
        return physicalMinPlayers;
    }

    public Integer getPhysicalMaxPlayers() {
        return physicalMaxPlayers;
    }

    /**
     * True if online or local play is flagged as supported.
     */
    public boolean claimsMultiplayer() {
        return Boolean.TRUE.equals(supportsOnline) || Boolean.TRUE.equals(supportsLocal);
    }

    /**
     * True if an online or local maximum is known.
     */
    public boolean hasModePlayerCounts() {
        return onlineMaxPlayers != null || localMaxPlayers != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .overallMinPlayers(overallMinPlayers)
                .overallMaxPlayers(overallMaxPlayers)
                .supportsOnline(supportsOnline)
                .onlineMinPlayers(onlineMinPlayers)
                .onlineMaxPlayers(onlineMaxPlayers)
                .supportsLocal(supportsLocal)
                .localMinPlayers(localMinPlayers)
                .localMaxPlayers(localMaxPlayers)
                .supportsPhysical(supportsPhysical)
                .physicalMinPlayers(physicalMinPlayers)
                .physicalMaxPlayers(physicalMaxPlayers);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlayerInfo that = (PlayerInfo) o;
        return Objects.equals(overallMinPlayers, that.overallMinPlayers)
                && Objects.equals(overallMaxPlayers, that.overallMaxPlayers)
                && Objects.equals(supportsOnline, that.supportsOnline)
                && Objects.equals(onlineMinPlayers, that.onlineMinPlayers)
                && Objects.equals(onlineMaxPlayers, that.onlineMaxPlayers)
                && Objects.equals(supportsLocal, that.supportsLocal)
                && Objects.equals(localMinPlayers, that.localMinPlayers)
                && Objects.equals(localMaxPlayers, that.localMaxPlayers)
                && Objects.equals(supportsPhysical, that.supportsPhysical)
                && Objects.equals(physicalMinPlayers, that.physicalMinPlayers)
                && Objects.equals(physicalMaxPlayers, that.physicalMaxPlayers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(overallMinPlayers, overallMaxPlayers, supportsOnline, onlineMinPlayers,
                onlineMaxPlayers, supportsLocal, localMinPlayers, localMaxPlayers, supportsPhysical,
                physicalMinPlayers, physicalMaxPlayers);
    }

    @Override
    public String toString() {
        return "PlayerInfo{" +
                "overall=" + overallMinPlayers + ".." + overallMaxPlayers +
                ", online=" + supportsOnline + "(" + onlineMinPlayers + ".." + onlineMaxPlayers + ")" +
                ", local=" + supportsLocal + "(" + localMinPlayers + ".." + localMaxPlayers + ")" +
                ", physical=" + supportsPhysical + "(" + physicalMinPlayers + ".." + physicalMaxPlayers + ")" +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer overallMinPlayers;
        private Integer overallMaxPlayers;
        private Boolean supportsOnline;
        private Integer onlineMinPlayers;
        private Integer onlineMaxPlayers;
        private Boolean supportsLocal;
        private Integer localMinPlayers;
        private Integer localMaxPlayers;
        private Boolean supportsPhysical;
        private Integer physicalMinPlayers;
        private Integer physicalMaxPlayers;

        public Builder overallMinPlayers(Integer overallMinPlayers) {
            this.overallMinPlayers = overallMinPlayers;
            return this;
        }

        public Builder overallMaxPlayers(Integer overallMaxPlayers) {
            this.overallMaxPlayers = overallMaxPlayers;
            return this;
        }

        public Builder supportsOnline(Boolean supportsOnline) {
            this.supportsOnline = supportsOnline;
            return this;
        }

        public Builder onlineMinPlayers(Integer onlineMinPlayers) {
            this.onlineMinPlayers = onlineMinPlayers;
            return this;
        }

        public Builder onlineMaxPlayers(Integer onlineMaxPlayers) {
            this.onlineMaxPlayers = onlineMaxPlayers;
            return this;
        }

        public Builder supportsLocal(Boolean supportsLocal) {
            this.supportsLocal = supportsLocal;
            return this;
        }

        public Builder localMinPlayers(Integer localMinPlayers) {
            this.localMinPlayers = localMinPlayers;
            return this;
        }

        public Builder localMaxPlayers(Integer localMaxPlayers) {
            this.localMaxPlayers = localMaxPlayers;
            return this;
        }

        public Builder supportsPhysical(Boolean supportsPhysical) {
            this.supportsPhysical = supportsPhysical;
            return this;
        }

        public Builder physicalMinPlayers(Integer physicalMinPlayers) {
            this.physicalMinPlayers = physicalMinPlayers;
            return this;
        }

        public Builder physicalMaxPlayers(Integer physicalMaxPlayers) {
            this.physicalMaxPlayers = physicalMaxPlayers;
            return this;
        }

        public PlayerInfo build() {
            return new PlayerInfo(this);
        }
    }
}
