package no.cantara.registry.model;

/**
 * Filter parameters of one catalog query. Every field is optional.
 *
 * @param platformVersion Kibana version packages must be compatible with
 * @param category        category packages must carry
 * @param packageName     exact package name
 * @param all             return every matching version instead of the newest per name
 * @param internal        include packages flagged as internal
 */
public record Query(
        Version platformVersion,
        String category,
        String packageName,
        boolean all,
        boolean internal
) {
    private static final Query DEFAULTS = new Query(null, null, null, false, false);

    public static Query defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Version platformVersion;
        private String category;
        private String packageName;
        private boolean all;
        private boolean internal;

        private Builder() {}

        public Builder platformVersion(Version platformVersion) {
            this.platformVersion = platformVersion;
            return this;
        }

        /** @throws no.cantara.registry.MalformedVersionException on an unparsable version */
        public Builder platformVersion(String platformVersion) {
            this.platformVersion = Version.parse(platformVersion);
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder all(boolean all) {
            this.all = all;
            return this;
        }

        public Builder internal(boolean internal) {
            this.internal = internal;
            return this;
        }

        public Query build() {
            return new Query(platformVersion, blankToNull(category), blankToNull(packageName), all, internal);
        }

        private static String blankToNull(String s) {
            return s == null || s.isBlank() ? null : s;
        }
    }
}
