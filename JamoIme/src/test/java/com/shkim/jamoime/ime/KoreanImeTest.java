package com.shkim.jamoime.ime;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.shkim.jamoime.layout.CheonJiIn;
import com.shkim.jamoime.layout.StandardDubeolsik;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KoreanImeTest {

    private KoreanIme ime;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        ime = StandardDubeolsik.create();
        listener = new RecordingListener();
        ime.setListener(listener);
    }

    @Test
    void inputReturnsCommittedAndComposingText() {
        assertEquals(ImeResult.of("", "ㅎ"), ime.input("ㅎ"));
        assertEquals(ImeResult.of("", "하"), ime.input("ㅏ"));
        assertEquals(ImeResult.of("", "한"), ime.input("ㄴ"));
        assertEquals(ImeResult.of("한", "ㄱ"), ime.input("ㄱ"));
    }

    @Test
    void listenerSeesEveryResult() {
        ime.input("ㄱ");
        ime.input("ㅏ");
        ime.input("ㄴ");
        ime.input("ㅏ");
        assertEquals(4, listener.composing.size());
        assertEquals("가", listener.committed.toString());
        assertEquals("나", listener.composing.get(3));

        assertEquals("나", ime.forceCommit());
        assertEquals("가나", listener.committed.toString());
        assertEquals("", listener.composing.get(4));
    }

    @Test
    void unknownKeyLeavesStateUntouched() {
        ime.input("ㄱ");
        ImeResult res = ime.input("€");
        assertEquals("", res.committed());
        assertEquals("ㄱ", res.composing());
        assertEquals("ㄱ", ime.getComposingText());
        assertEquals(ImeResult.of("", "ㄱ"), ime.input(null));
    }

    @Test
    void backspaceIsHandedToHostWhenNothingIsComposed() {
        ImeResult res = ime.backspace();
        assertTrue(res.isBackspaceRequested());
        assertEquals("", res.composing());
        assertEquals(1, listener.backspaceRequests);

        ime.input("ㄱ");
        ImeResult erased = ime.backspace();
        assertFalse(erased.isBackspaceRequested());
        assertEquals("", erased.composing());
        assertEquals(1, listener.backspaceRequests);

        assertTrue(ime.backspace().isBackspaceRequested());
        assertEquals(2, listener.backspaceRequests);
    }

    @Test
    void backspaceAfterForceCommitIsHandedToHost() {
        ime.input("ㄱ");
        assertEquals("ㄱ", ime.forceCommit());
        assertFalse(ime.hasComposingText());
        assertTrue(ime.backspace().isBackspaceRequested());
    }

    @Test
    void forceCommitOnFreshSessionCommitsNothing() {
        assertEquals("", ime.forceCommit());
        assertEquals("", ime.forceCommit());
        assertEquals(ImeResult.of("", "ㄱ"), ime.input("ㄱ"));
    }

    @Test
    void resetDropsComposingText() {
        ime.input("ㄱ");
        ime.input("ㅏ");
        ime.reset();
        assertEquals("", ime.getComposingText());
        assertFalse(ime.hasComposingText());
        assertEquals(1, ime.getUncommittedSyllables().size());
        assertEquals("", ime.forceCommit());
    }

    @Test
    void stateInfoDescribesCurrentSyllable() {
        ime.input("ㄱ");
        ime.input("ㅏ");
        StateInfo info = ime.getCurrentStateInfo();
        assertTrue(info.hasLead());
        assertTrue(info.hasVowel());
        assertFalse(info.hasTrail());
        assertFalse(info.hasNonJamo());
        assertEquals("ㄱ", info.getLead());
        assertEquals("ㅏ", info.getVowel());
        assertNull(info.getTrail());

        ime.input(".");
        assertTrue(ime.getCurrentStateInfo().hasNonJamo());
        assertEquals(".", ime.getCurrentStateInfo().getNonJamo());
    }

    @Test
    void explicitCommitKeepsFinishedSyllables() {
        KoreanIme cheonJiIn = CheonJiIn.create();
        for (String key : new String[]{"ㄱ", "ㅣ", "ㆍ", "ㄴ", "ㄴ", "ㅈ"}) {
            assertEquals("", cheonJiIn.input(key).committed());
        }
        assertEquals("갈ㅈ", cheonJiIn.getComposingText());
        assertEquals(2, cheonJiIn.getUncommittedSyllables().size());
        assertEquals("갈ㅈ", cheonJiIn.forceCommit());
        assertTrue(cheonJiIn.getUncommittedSyllables().isEmpty());
    }

    @Test
    void sameKeysGiveSameSnapshots() {
        String[] keys = {"ㄷ", "ㅏ", "ㄹ", "ㄱ", "ㅣ", "ㄴ", "ㅡ", "ㄴ", ".", "ㅇ"};
        KoreanIme other = StandardDubeolsik.create();
        for (String key : keys) {
            assertEquals(ime.input(key), other.input(key));
        }
        assertEquals(ime.getUncommittedSyllables(), other.getUncommittedSyllables());
    }

    @Test
    void layoutIsReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> ime.getLayout().clear());
        assertEquals("ㄱ", ime.getLayout().get("r").keyIdentifier());
    }

    private static final class RecordingListener implements KoreanImeListener {
        private final StringBuilder committed = new StringBuilder();
        private final List<String> composing = new ArrayList<>();
        private int backspaceRequests;

        @Override
        public void onResult(KoreanIme ime, String committed, String composing) {
            this.committed.append(committed);
            this.composing.add(composing);
        }

        @Override
        public void onBackspaceRequested(KoreanIme ime) {
            backspaceRequests++;
        }
    }
}
