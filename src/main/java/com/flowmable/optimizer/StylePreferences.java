package com.flowmable.optimizer;

/**
 * Style toggles that bias parameter derivation toward conservative values.
 * Supplied once per run and shared read-only across all images.
 *
 * @param naturalAppearance  Prefer subtle corrections
 * @param preserveHighlights Always keep some highlight recovery
 * @param stableSkinTones    Keep skin hues out of saturation changes
 * @param avoidFilterLook    Narrow every adjustment toward identity
 */
public record StylePreferences(
        boolean naturalAppearance,
        boolean preserveHighlights,
        boolean stableSkinTones,
        boolean avoidFilterLook
) {
    public static final StylePreferences DEFAULT = new StylePreferences(true, true, true, true);

    /** Every toggle off: the strongest corrections the deriver produces. */
    public static final StylePreferences AGGRESSIVE = new StylePreferences(false, false, false, false);
}
