package com.shkim.jamoime.layout;

import java.util.LinkedHashMap;
import java.util.Map;

import com.shkim.jamoime.automaton.Automaton;
import com.shkim.jamoime.automaton.BackspaceAutomaton;
import com.shkim.jamoime.automaton.DokkaebiAutomaton;
import com.shkim.jamoime.core.DisplayMode;
import com.shkim.jamoime.core.InputProcessor;
import com.shkim.jamoime.core.JamoCommitPolicy;
import com.shkim.jamoime.core.NonJamoCommitPolicy;
import com.shkim.jamoime.core.OrderMode;
import com.shkim.jamoime.core.ProcessorConfig;
import com.shkim.jamoime.core.TransitionCommitPolicy;
import com.shkim.jamoime.core.VirtualKey;
import com.shkim.jamoime.ime.KoreanIme;

/**
 * 천지인 keypad.
 * <p>
 * Seven consonant keys (repeating a key gives the aspirated and then the tense consonant),
 * three vowel keys (ㅣ, ㆍ, ㅡ) stroked together into vowels, and one punctuation key cycling {@code . , ? !}.
 * Nothing is committed until {@link #forceCommit()}; an isolated consonant may turn into a trail cluster.
 * <p>
 * Trail states {@code ㄴㅅ}, {@code ㄹㅇ} and {@code ㄹㄷ} are intermediate strokes of ㄶ, ㄻ and ㄾ.
 */
public final class CheonJiIn extends KoreanIme {
    public static final String DOT = "ㆍ";
    public static final String DOUBLE_DOT = "ᆢ";

    // keypad key, jamo id
    private static final String[][] KEYS = {
            {"q", "ㄱ"}, {"w", "ㄴ"}, {"e", "ㄷ"}, {"a", "ㅂ"}, {"s", "ㅅ"}, {"d", "ㅈ"}, {"x", "ㅇ"},
            {"1", "ㅣ"}, {"2", DOT}, {"3", "ㅡ"},
    };
    private static final String PUNCTUATION_KEY = "c";

    // repeated strokes shared by leads and trails: from, input, to
    private static final String[][] CONSONANT_STROKES = {
            {"ㄱ", "ㄱ", "ㅋ"}, {"ㅋ", "ㄱ", "ㄲ"}, {"ㄴ", "ㄴ", "ㄹ"}, {"ㄷ", "ㄷ", "ㅌ"}, {"ㅌ", "ㄷ", "ㄸ"},
            {"ㅂ", "ㅂ", "ㅍ"}, {"ㅍ", "ㅂ", "ㅃ"}, {"ㅅ", "ㅅ", "ㅎ"}, {"ㅎ", "ㅅ", "ㅆ"}, {"ㅈ", "ㅈ", "ㅊ"},
            {"ㅊ", "ㅈ", "ㅉ"}, {"ㅇ", "ㅇ", "ㅁ"},
    };
    private static final String[] BASE_CONSONANTS = {"ㄱ", "ㄴ", "ㄷ", "ㅂ", "ㅅ", "ㅈ", "ㅇ"};
    private static final String[] LEADS = {"ㄱ", "ㄲ", "ㄴ", "ㄷ", "ㄸ", "ㄹ", "ㅁ", "ㅂ", "ㅃ", "ㅅ", "ㅆ", "ㅇ", "ㅈ", "ㅉ", "ㅊ", "ㅋ", "ㅌ", "ㅍ", "ㅎ"};

    private static final String[][] VOWEL_STROKES = {
            {DOT, DOT, DOUBLE_DOT},
            {"ㅣ", DOT, "ㅏ"}, {"ㅏ", DOT, "ㅑ"}, {DOT, "ㅣ", "ㅓ"}, {DOUBLE_DOT, "ㅣ", "ㅕ"},
            {DOT, "ㅡ", "ㅗ"}, {DOUBLE_DOT, "ㅡ", "ㅛ"}, {"ㅡ", DOT, "ㅜ"}, {"ㅜ", DOT, "ㅠ"},
            {"ㅏ", "ㅣ", "ㅐ"}, {"ㅑ", "ㅣ", "ㅒ"}, {"ㅓ", "ㅣ", "ㅔ"}, {"ㅕ", "ㅣ", "ㅖ"},
            {"ㅗ", "ㅣ", "ㅚ"}, {"ㅚ", DOT, "ㅘ"}, {"ㅘ", "ㅣ", "ㅙ"},
            {"ㅠ", "ㅣ", "ㅝ"}, {"ㅝ", "ㅣ", "ㅞ"}, {"ㅜ", "ㅣ", "ㅟ"}, {"ㅡ", "ㅣ", "ㅢ"},
    };
    private static final String[][] VOWEL_DISPLAYS = {
            {"ㅣ", "ᅵ"}, {DOT, "ᆞ"}, {DOUBLE_DOT, "ᆢ"}, {"ㅡ", "ᅳ"},
            {"ㅏ", "ᅡ"}, {"ㅑ", "ᅣ"}, {"ㅓ", "ᅥ"}, {"ㅕ", "ᅧ"}, {"ㅗ", "ᅩ"},
            {"ㅛ", "ᅭ"}, {"ㅜ", "ᅮ"}, {"ㅠ", "ᅲ"}, {"ㅐ", "ᅢ"}, {"ㅒ", "ᅤ"},
            {"ㅔ", "ᅦ"}, {"ㅖ", "ᅨ"}, {"ㅚ", "ᅬ"}, {"ㅘ", "ᅪ"}, {"ㅙ", "ᅫ"},
            {"ㅝ", "ᅯ"}, {"ㅞ", "ᅰ"}, {"ㅟ", "ᅱ"}, {"ㅢ", "ᅴ"},
    };

    // trail clusters: from, input, to
    private static final String[][] CLUSTER_STROKES = {
            {"ㄱ", "ㅅ", "ㄳ"}, {"ㄴ", "ㅈ", "ㄵ"}, {"ㄴ", "ㅅ", "ㄴㅅ"}, {"ㄴㅅ", "ㅅ", "ㄶ"},
            {"ㄹ", "ㄱ", "ㄺ"}, {"ㄹ", "ㅇ", "ㄹㅇ"}, {"ㄹㅇ", "ㅇ", "ㄻ"}, {"ㄹ", "ㅂ", "ㄼ"},
            {"ㄹ", "ㅅ", "ㄽ"}, {"ㄹ", "ㄷ", "ㄹㄷ"}, {"ㄹㄷ", "ㄷ", "ㄾ"}, {"ㄼ", "ㅂ", "ㄿ"},
            {"ㄽ", "ㅅ", "ㅀ"}, {"ㅂ", "ㅅ", "ㅄ"},
    };
    private static final String[][] TRAIL_DISPLAYS = {
            {"ㄱ", "ᆨ"}, {"ㄲ", "ᆩ"}, {"ㄳ", "ᆪ"}, {"ㄴ", "ᆫ"}, {"ㄵ", "ᆬ"},
            {"ㄶ", "ᆭ"}, {"ㄷ", "ᆮ"}, {"ㄹ", "ᆯ"}, {"ㄺ", "ᆰ"}, {"ㄻ", "ᆱ"},
            {"ㄼ", "ᆲ"}, {"ㄽ", "ᆳ"}, {"ㄾ", "ᆴ"}, {"ㄿ", "ᆵ"}, {"ㅀ", "ᆶ"},
            {"ㅁ", "ᆷ"}, {"ㅂ", "ᆸ"}, {"ㅄ", "ᆹ"}, {"ㅅ", "ᆺ"}, {"ㅆ", "ᆻ"},
            {"ㅇ", "ᆼ"}, {"ㅈ", "ᆽ"}, {"ㅊ", "ᆾ"}, {"ㅋ", "ᆿ"}, {"ㅌ", "ᇀ"},
            {"ㅍ", "ᇁ"}, {"ㅎ", "ᇂ"},
            // no modern trail exists for these, they render as two jamo
            {"ㄸ", "ᆮᆮ"}, {"ㅃ", "ᆸᆸ"}, {"ㅉ", "ᆽᆽ"},
            {"ㄴㅅ", "ᆫᆺ"}, {"ㄹㅇ", "ᆯᆼ"}, {"ㄹㄷ", "ᆯᆮ"},
    };

    // trail, remaining trail, moved lead
    private static final String[][] SPLITS = {
            {"ㄳ", "ㄱ", "ㅅ"}, {"ㄵ", "ㄴ", "ㅈ"}, {"ㄶ", "ㄴ", "ㅎ"}, {"ㄺ", "ㄹ", "ㄱ"}, {"ㄻ", "ㄹ", "ㅁ"},
            {"ㄼ", "ㄹ", "ㅂ"}, {"ㄽ", "ㄹ", "ㅅ"}, {"ㄾ", "ㄹ", "ㅌ"}, {"ㄿ", "ㄹ", "ㅍ"}, {"ㅀ", "ㄹ", "ㅎ"},
            {"ㅄ", "ㅂ", "ㅅ"},
            {"ㄴㅅ", "ㄴ", "ㅅ"}, {"ㄹㅇ", "ㄹ", "ㅇ"}, {"ㄹㄷ", "ㄹ", "ㄷ"},
            {"ㄸ", "ㄷ", "ㄷ"}, {"ㅃ", "ㅂ", "ㅂ"}, {"ㅉ", "ㅈ", "ㅈ"},
    };
    private static final String[] MOVABLE_TRAILS = {"ㄱ", "ㄲ", "ㄴ", "ㄷ", "ㄹ", "ㅁ", "ㅂ", "ㅅ", "ㅆ", "ㅇ", "ㅈ", "ㅊ", "ㅋ", "ㅌ", "ㅍ", "ㅎ"};

    // from, to
    private static final String[][] BACKSPACES = {
            {DOUBLE_DOT, DOT}, {"ㅏ", "ㅣ"}, {"ㅑ", "ㅏ"}, {"ㅜ", "ㅡ"}, {"ㅠ", "ㅜ"},
            {"ㅐ", "ㅏ"}, {"ㅒ", "ㅑ"}, {"ㅔ", "ㅓ"}, {"ㅖ", "ㅕ"}, {"ㅚ", "ㅗ"}, {"ㅘ", "ㅚ"}, {"ㅙ", "ㅘ"},
            {"ㅝ", "ㅠ"}, {"ㅞ", "ㅝ"}, {"ㅟ", "ㅜ"}, {"ㅢ", "ㅡ"},
            {"ㄳ", "ㄱ"}, {"ㄵ", "ㄴ"}, {"ㄶ", "ㄴㅅ"}, {"ㄴㅅ", "ㄴ"}, {"ㄺ", "ㄹ"}, {"ㄻ", "ㄹㅇ"},
            {"ㄹㅇ", "ㄹ"}, {"ㄼ", "ㄹ"}, {"ㄽ", "ㄹ"}, {"ㄾ", "ㄹㄷ"}, {"ㄹㄷ", "ㄹ"}, {"ㅀ", "ㄽ"},
            {"ㄿ", "ㄼ"}, {"ㅄ", "ㅂ"},
    };

    private static final String[] PUNCTUATION_CYCLE = {".", ",", "?", "!"};

    public static final ProcessorConfig CONFIG = new ProcessorConfig.Builder()
            .setOrderMode(OrderMode.SEQUENTIAL)
            .setJamoCommitPolicy(JamoCommitPolicy.EXPLICIT_COMMIT)
            .setNonJamoCommitPolicy(NonJamoCommitPolicy.EXPLICIT_COMMIT)
            .setTransitionCommitPolicy(TransitionCommitPolicy.NEVER)
            .setDisplayMode(DisplayMode.MODERN_MULTIPLE)
            .setSupportStandaloneCluster(true)
            .build();

    public CheonJiIn() {
        super(createProcessor(), createLayout());
    }

    public static CheonJiIn create() {
        return new CheonJiIn();
    }

    public static Map<String, VirtualKey> createLayout() {
        Map<String, VirtualKey> res = new LinkedHashMap<>();
        for (String[] k : KEYS) {
            res.put(k[0], new VirtualKey(k[1]));
        }
        for (String[] k : KEYS) {
            res.put(k[1], new VirtualKey(k[1]));
        }
        res.put(PUNCTUATION_KEY, new VirtualKey(PUNCTUATION_CYCLE[0], PUNCTUATION_CYCLE[0], true));
        return res;
    }

    public static InputProcessor createProcessor() {
        return InputProcessor.builder()
                .setLead(createLeadAutomaton())
                .setVowel(createVowelAutomaton())
                .setTrail(createTrailAutomaton())
                .setNonJamo(createPunctuationAutomaton())
                .setDokkaebi(createDokkaebiAutomaton())
                .setBackspace(createBackspaceAutomaton())
                .setConfig(CONFIG)
                .build();
    }

    static Automaton createLeadAutomaton() {
        Automaton.Builder res = consonantStrokes();
        for (int i = 0; i < LEADS.length; i++) {
            res.display(LEADS[i], String.valueOf((char) (0x1100 + i)));
        }
        return res.build();
    }

    static Automaton createVowelAutomaton() {
        Automaton.Builder res = Automaton.builder();
        for (String v : new String[]{"ㅣ", DOT, "ㅡ"}) {
            res.transition(Automaton.START, v, v);
        }
        for (String[] s : VOWEL_STROKES) {
            res.transition(s[0], s[1], s[2]);
        }
        for (String[] d : VOWEL_DISPLAYS) {
            res.display(d[0], d[1]);
        }
        return res.build();
    }

    static Automaton createTrailAutomaton() {
        Automaton.Builder res = consonantStrokes();
        for (String[] s : CLUSTER_STROKES) {
            res.transition(s[0], s[1], s[2]);
        }
        for (String[] d : TRAIL_DISPLAYS) {
            res.display(d[0], d[1]);
        }
        return res.build();
    }

    private static Automaton.Builder consonantStrokes() {
        Automaton.Builder res = Automaton.builder();
        for (String c : BASE_CONSONANTS) {
            res.transition(Automaton.START, c, c);
        }
        for (String[] s : CONSONANT_STROKES) {
            res.transition(s[0], s[1], s[2]);
        }
        return res;
    }

    static Automaton createPunctuationAutomaton() {
        String key = PUNCTUATION_CYCLE[0];
        Automaton.Builder res = Automaton.builder().transition(Automaton.START, key, key);
        for (int i = 1; i < PUNCTUATION_CYCLE.length; i++) {
            res.transition(PUNCTUATION_CYCLE[i - 1], key, PUNCTUATION_CYCLE[i]);
        }
        for (String p : PUNCTUATION_CYCLE) {
            res.display(p, p);
        }
        return res.build();
    }

    static DokkaebiAutomaton createDokkaebiAutomaton() {
        DokkaebiAutomaton.Builder res = DokkaebiAutomaton.builder();
        for (String[] s : SPLITS) {
            res.vowelTrigger(s[0], s[1], s[2]);
        }
        for (String t : MOVABLE_TRAILS) {
            res.vowelTrigger(t, null, t);
        }
        return res.build();
    }

    static BackspaceAutomaton createBackspaceAutomaton() {
        BackspaceAutomaton.Builder res = BackspaceAutomaton.builder();
        for (String[] b : BACKSPACES) {
            res.transition(b[0], b[1]);
        }
        return res.build();
    }
}
