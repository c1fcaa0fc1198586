package io.strata.core.archive;

/**
 * Prefix/suffix text delta. A delta has the form {@code <prefixLength>:<suffixLength>:<middle>}:
 * the target is the base's first {@code prefixLength} chars, then {@code middle}, then the base's
 * last {@code suffixLength} chars.
 */
public final class DeltaCodec {

    public String encode(String base, String target) {
        String safeBase = base == null ? "" : base;
        String safeTarget = target == null ? "" : target;
        int max = Math.min(safeBase.length(), safeTarget.length());

        int prefix = 0;
        while (prefix < max && safeBase.charAt(prefix) == safeTarget.charAt(prefix)) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < max - prefix
            && safeBase.charAt(safeBase.length() - 1 - suffix) == safeTarget.charAt(safeTarget.length() - 1 - suffix)) {
            suffix++;
        }
        String middle = safeTarget.substring(prefix, safeTarget.length() - suffix);
        return prefix + ":" + suffix + ":" + middle;
    }

    public String decode(String base, String delta) {
        String safeBase = base == null ? "" : base;
        if (delta == null) {
            throw new IllegalArgumentException("delta must not be null");
        }
        int first = delta.indexOf(':');
        int second = first < 0 ? -1 : delta.indexOf(':', first + 1);
        if (first <= 0 || second <= first + 1) {
            throw new IllegalArgumentException("Malformed delta header");
        }
        int prefix;
        int suffix;
        try {
            prefix = Integer.parseInt(delta.substring(0, first));
            suffix = Integer.parseInt(delta.substring(first + 1, second));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed delta header", e);
        }
        if (prefix < 0 || suffix < 0 || prefix + suffix > safeBase.length()) {
            throw new IllegalArgumentException("Delta does not fit its base");
        }
        return safeBase.substring(0, prefix)
            + delta.substring(second + 1)
            + safeBase.substring(safeBase.length() - suffix);
    }
}
