package edictjava;

import java.util.Objects;

/**
 * A single deinflection rule: replace the suffix {@code suffixFrom} of a word with
 * {@code suffixTo}.
 *
 * <p>The type mask packs two 8-bit class fields (see {@link WordClass}):</p>
 * <ul>
 *   <li>bits 0-7: classes the inflected word must have for the rule to apply</li>
 *   <li>bits 8-15: classes of the resulting, shorter word</li>
 * </ul>
 */
public final class InflectionRule {
    private final String suffixFrom;
    private final String suffixTo;
    private final int typeMask;
    private final String reason;

    /**
     * @param suffixFrom suffix to look for; must not be empty
     * @param suffixTo   replacement suffix; may be empty
     * @param typeMask   packed class masks
     * @param reason     human-readable explanation of the removed inflection
     */
    public InflectionRule(String suffixFrom, String suffixTo, int typeMask, String reason) {
        this.suffixFrom = Objects.requireNonNull(suffixFrom, "suffixFrom");
        this.suffixTo = Objects.requireNonNull(suffixTo, "suffixTo");
        this.reason = Objects.requireNonNull(reason, "reason");
        if (suffixFrom.isEmpty()) {
            throw new IllegalArgumentException("suffixFrom must not be empty");
        }
        this.typeMask = typeMask;
    }

    public String getSuffixFrom() {
        return suffixFrom;
    }

    public String getSuffixTo() {
        return suffixTo;
    }

    public int getTypeMask() {
        return typeMask;
    }

    public String getReason() {
        return reason;
    }

    /**
     * @return classes the inflected word must have (low byte of the type mask)
     */
    public int requiredMask() {
        return typeMask & 0xFF;
    }

    /**
     * @return classes of the word produced by this rule (high bits of the type mask)
     */
    public int resultMask() {
        return typeMask >>> 8;
    }

    /**
     * Returns whether this rule may be applied to a word whose classes are {@code wordMask}.
     *
     * @param wordMask class mask of the candidate word
     * @return {@code true} if at least one required class is present
     */
    public boolean appliesTo(int wordMask) {
        return (wordMask & requiredMask()) != 0;
    }

    /**
     * Rewrites {@code word} by replacing this rule's suffix.
     * The caller guarantees that {@code word} ends with {@link #getSuffixFrom()}.
     *
     * @param word inflected word
     * @return deinflected word
     */
    public String rewrite(String word) {
        String prefix = word.substring(0, word.length() - suffixFrom.length());
        return prefix + suffixTo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InflectionRule)) return false;
        InflectionRule that = (InflectionRule) o;
        return typeMask == that.typeMask
                && suffixFrom.equals(that.suffixFrom)
                && suffixTo.equals(that.suffixTo)
                && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(suffixFrom, suffixTo, typeMask, reason);
    }

    @Override
    public String toString() {
        return suffixFrom + " → " + suffixTo + " (" + reason + ", 0x" + Integer.toHexString(typeMask) + ")";
    }
}
