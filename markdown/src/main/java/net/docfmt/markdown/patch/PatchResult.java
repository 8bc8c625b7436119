package net.docfmt.markdown.patch;

import org.jetbrains.annotations.Nullable;

/**
 * @param text    the patched text, or the original text if patching failed
 * @param failure why patching failed, {@code null} on success
 */
public record PatchResult(String text, boolean changed, @Nullable String failure) {
    public static PatchResult unchanged(String original) {
        return new PatchResult(original, false, null);
    }

    public static PatchResult patched(String text) {
        return new PatchResult(text, true, null);
    }

    public static PatchResult failed(String original, String failure) {
        return new PatchResult(original, false, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
