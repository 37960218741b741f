package com.shkim.jamoime.layout;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.shkim.jamoime.config.ImeFactory;
import com.shkim.jamoime.config.Preset;
import com.shkim.jamoime.ime.ConfigurableKoreanIme;
import com.shkim.jamoime.ime.ImeResult;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 천지인 플러스 exists only as a bundled document.
 */
class CheonJiInPlusTest {

    private ConfigurableKoreanIme ime;

    @BeforeEach
    void setUp() {
        ime = ImeFactory.createFromPreset(Preset.CHEONJIIN_PLUS);
    }

    private String press(String... keys) {
        String res = "";
        for (String key : keys) {
            res = ime.input(key).composing();
        }
        return res;
    }

    @Test
    void doubledKeyGivesTenseConsonant() {
        assertEquals("ㄲ", press("ㅋ", "ㅋ"));
        assertEquals("깐", press("ㅣ", "ㆍ", "ㄴ"));
        ime.reset();
        assertEquals("갔", press("ㄱ", "ㅣ", "ㆍ", "ㅅ", "ㅅ"));
    }

    @Test
    void backspaceUndoesDoubling() {
        press("ㅋ", "ㅋ");
        assertEquals("ㅋ", ime.backspace().composing());
    }

    @Test
    void punctuationFollowsHangul() {
        press("ㅋ", "ㅋ", "ㅣ", "ㆍ", "ㄴ");

        ImeResult dot = ime.input(".,");
        assertEquals("깐", dot.committed());
        assertEquals(".", dot.composing());

        ImeResult question = ime.input("?!");
        assertEquals(".", question.committed());
        assertEquals("?", question.composing());

        assertEquals("?", ime.forceCommit());
    }

    @Test
    void completedPunctuationIsCommitted() {
        ime.input("?!");
        ImeResult res = ime.input("?!");
        assertEquals("!", res.committed());
        assertEquals("", res.composing());
    }

    @Test
    void repeatedConsonantSplitsCluster() {
        assertEquals("갃", press("ㄱ", "ㅣ", "ㆍ", "ㄱ", "ㅅ"));
        assertEquals("각ㅆ", press("ㅅ"));
        assertEquals("각씨", press("ㅣ"));
        assertEquals("각씨", ime.forceCommit());
    }

    @Test
    void identity() {
        assertEquals("cheonjiin-plus", ime.getIdentifier());
        assertEquals("천지인 플러스", ime.getName());
    }
}
