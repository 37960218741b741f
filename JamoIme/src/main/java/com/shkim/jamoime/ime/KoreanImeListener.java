package com.shkim.jamoime.ime;

/**
 * Optional callback for hosts that prefer notifications to return values.
 * Invoked synchronously from inside {@link KoreanIme#input(String)}, {@link KoreanIme#backspace()}
 * and {@link KoreanIme#forceCommit()}.
 */
public interface KoreanImeListener {

    /**
     * Called after every input, backspace and forced commit.
     *
     * @param ime       {@link KoreanIme} the source
     * @param committed String, the committed text, possibly empty
     * @param composing String, the current composing text
     */
    void onResult(KoreanIme ime, String committed, String composing);

    /**
     * Called when the engine holds no uncommitted state and the host has to erase a character of its own buffer.
     *
     * @param ime {@link KoreanIme} the source
     */
    default void onBackspaceRequested(KoreanIme ime) {
    }
}
