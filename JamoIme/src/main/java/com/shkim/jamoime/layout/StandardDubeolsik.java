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
 * 표준 두벌식 (KS X 5002).
 * <p>
 * QWERTY letters map to jamo, the jamo themselves are accepted as keys too.
 * Digits and punctuation are non-jamo keys rendered as they are.
 * Each syllable is committed as soon as the next one starts.
 */
public final class StandardDubeolsik extends KoreanIme {

    // qwerty key, jamo id, shifted key, shifted jamo id (null if shift gives the same jamo)
    private static final String[][] CONSONANT_KEYS = {
            {"r", "ㄱ", "R", "ㄲ"}, {"s", "ㄴ", "S", null}, {"e", "ㄷ", "E", "ㄸ"}, {"f", "ㄹ", "F", null},
            {"a", "ㅁ", "A", null}, {"q", "ㅂ", "Q", "ㅃ"}, {"t", "ㅅ", "T", "ㅆ"}, {"d", "ㅇ", "D", null},
            {"w", "ㅈ", "W", "ㅉ"}, {"c", "ㅊ", "C", null}, {"z", "ㅋ", "Z", null}, {"x", "ㅌ", "X", null},
            {"v", "ㅍ", "V", null}, {"g", "ㅎ", "G", null},
    };
    private static final String[][] VOWEL_KEYS = {
            {"k", "ㅏ", "K", null}, {"o", "ㅐ", "O", "ㅒ"}, {"i", "ㅑ", "I", null}, {"j", "ㅓ", "J", null},
            {"p", "ㅔ", "P", "ㅖ"}, {"u", "ㅕ", "U", null}, {"h", "ㅗ", "H", null}, {"y", "ㅛ", "Y", null},
            {"n", "ㅜ", "N", null}, {"b", "ㅠ", "B", null}, {"m", "ㅡ", "M", null}, {"l", "ㅣ", "L", null},
    };
    private static final String NON_JAMO_KEYS = "1234567890`-=[]\\;',./ ~!@#$%^&*()_+{}|:\"<>?";

    private static final String[] LEADS = {"ㄱ", "ㄲ", "ㄴ", "ㄷ", "ㄸ", "ㄹ", "ㅁ", "ㅂ", "ㅃ", "ㅅ", "ㅆ", "ㅇ", "ㅈ", "ㅉ", "ㅊ", "ㅋ", "ㅌ", "ㅍ", "ㅎ"};
    // simple vowels and their combining jamo
    private static final String[][] VOWELS = {
            {"ㅏ", "ᅡ"}, {"ㅐ", "ᅢ"}, {"ㅑ", "ᅣ"}, {"ㅒ", "ᅤ"}, {"ㅓ", "ᅥ"}, {"ㅔ", "ᅦ"},
            {"ㅕ", "ᅧ"}, {"ㅖ", "ᅨ"}, {"ㅗ", "ᅩ"}, {"ㅛ", "ᅭ"}, {"ㅜ", "ᅮ"}, {"ㅠ", "ᅲ"},
            {"ㅡ", "ᅳ"}, {"ㅣ", "ᅵ"},
    };
    // from, input, to, combining jamo
    private static final String[][] COMPOUND_VOWELS = {
            {"ㅗ", "ㅏ", "ㅘ", "ᅪ"}, {"ㅗ", "ㅐ", "ㅙ", "ᅫ"}, {"ㅗ", "ㅣ", "ㅚ", "ᅬ"},
            {"ㅜ", "ㅓ", "ㅝ", "ᅯ"}, {"ㅜ", "ㅔ", "ㅞ", "ᅰ"}, {"ㅜ", "ㅣ", "ㅟ", "ᅱ"},
            {"ㅡ", "ㅣ", "ㅢ", "ᅴ"},
    };
    private static final String[][] TRAILS = {
            {"ㄱ", "ᆨ"}, {"ㄲ", "ᆩ"}, {"ㄴ", "ᆫ"}, {"ㄷ", "ᆮ"}, {"ㄹ", "ᆯ"}, {"ㅁ", "ᆷ"},
            {"ㅂ", "ᆸ"}, {"ㅅ", "ᆺ"}, {"ㅆ", "ᆻ"}, {"ㅇ", "ᆼ"}, {"ㅈ", "ᆽ"}, {"ㅊ", "ᆾ"},
            {"ㅋ", "ᆿ"}, {"ㅌ", "ᇀ"}, {"ㅍ", "ᇁ"}, {"ㅎ", "ᇂ"},
    };
    // from, input, to, combining jamo; "from" is also what stays behind when the cluster is split
    private static final String[][] COMPOUND_TRAILS = {
            {"ㄱ", "ㅅ", "ㄳ", "ᆪ"}, {"ㄴ", "ㅈ", "ㄵ", "ᆬ"}, {"ㄴ", "ㅎ", "ㄶ", "ᆭ"},
            {"ㄹ", "ㄱ", "ㄺ", "ᆰ"}, {"ㄹ", "ㅁ", "ㄻ", "ᆱ"}, {"ㄹ", "ㅂ", "ㄼ", "ᆲ"},
            {"ㄹ", "ㅅ", "ㄽ", "ᆳ"}, {"ㄹ", "ㅌ", "ㄾ", "ᆴ"}, {"ㄹ", "ㅍ", "ㄿ", "ᆵ"},
            {"ㄹ", "ㅎ", "ㅀ", "ᆶ"}, {"ㅂ", "ㅅ", "ㅄ", "ᆹ"},
    };

    public static final ProcessorConfig CONFIG = new ProcessorConfig.Builder()
            .setOrderMode(OrderMode.SEQUENTIAL)
            .setJamoCommitPolicy(JamoCommitPolicy.SYLLABLE)
            .setNonJamoCommitPolicy(NonJamoCommitPolicy.CHARACTER)
            .setTransitionCommitPolicy(TransitionCommitPolicy.ALWAYS)
            .setDisplayMode(DisplayMode.MODERN_MULTIPLE)
            .setSupportStandaloneCluster(false)
            .build();

    public StandardDubeolsik() {
        super(createProcessor(), createLayout());
    }

    public static StandardDubeolsik create() {
        return new StandardDubeolsik();
    }

    public static Map<String, VirtualKey> createLayout() {
        Map<String, VirtualKey> res = new LinkedHashMap<>();
        for (char c : NON_JAMO_KEYS.toCharArray()) {
            String key = String.valueOf(c);
            res.put(key, VirtualKey.nonJamo(key));
        }
        addJamoKeys(res, CONSONANT_KEYS);
        addJamoKeys(res, VOWEL_KEYS);
        return res;
    }

    private static void addJamoKeys(Map<String, VirtualKey> res, String[][] keys) {
        for (String[] k : keys) {
            res.put(k[0], new VirtualKey(k[1]));
            res.put(k[2], new VirtualKey(k[3] == null ? k[1] : k[3]));
            res.put(k[1], new VirtualKey(k[1]));
            if (k[3] != null) {
                res.put(k[3], new VirtualKey(k[3]));
            }
        }
    }

    public static InputProcessor createProcessor() {
        return InputProcessor.builder()
                .setLead(createLeadAutomaton())
                .setVowel(createVowelAutomaton())
                .setTrail(createTrailAutomaton())
                .setNonJamo(createNonJamoAutomaton())
                .setDokkaebi(createDokkaebiAutomaton())
                .setBackspace(createBackspaceAutomaton())
                .setConfig(CONFIG)
                .build();
    }

    static Automaton createLeadAutomaton() {
        Automaton.Builder res = Automaton.builder();
        for (int i = 0; i < LEADS.length; i++) {
            res.transition(Automaton.START, LEADS[i], LEADS[i]).display(LEADS[i], String.valueOf((char) (0x1100 + i)));
        }
        return res.build();
    }

    static Automaton createVowelAutomaton() {
        Automaton.Builder res = Automaton.builder();
        for (String[] v : VOWELS) {
            res.transition(Automaton.START, v[0], v[0]).display(v[0], v[1]);
        }
        for (String[] v : COMPOUND_VOWELS) {
            res.transition(v[0], v[1], v[2]).display(v[2], v[3]);
        }
        return res.build();
    }

    static Automaton createTrailAutomaton() {
        Automaton.Builder res = Automaton.builder();
        for (String[] t : TRAILS) {
            res.transition(Automaton.START, t[0], t[0]).display(t[0], t[1]);
        }
        for (String[] t : COMPOUND_TRAILS) {
            res.transition(t[0], t[1], t[2]).display(t[2], t[3]);
        }
        return res.build();
    }

    static Automaton createNonJamoAutomaton() {
        Automaton.Builder res = Automaton.builder();
        for (char c : NON_JAMO_KEYS.toCharArray()) {
            String key = String.valueOf(c);
            res.transition(Automaton.START, key, key).display(key, key);
        }
        return res.build();
    }

    static DokkaebiAutomaton createDokkaebiAutomaton() {
        DokkaebiAutomaton.Builder res = DokkaebiAutomaton.builder();
        for (String[] t : TRAILS) {
            res.vowelTrigger(t[0], null, t[0]);
        }
        for (String[] t : COMPOUND_TRAILS) {
            res.vowelTrigger(t[2], t[0], t[1]);
        }
        return res.build();
    }

    static BackspaceAutomaton createBackspaceAutomaton() {
        BackspaceAutomaton.Builder res = BackspaceAutomaton.builder();
        for (String[] t : COMPOUND_TRAILS) {
            res.transition(t[2], t[0]);
        }
        for (String[] v : COMPOUND_VOWELS) {
            res.transition(v[2], v[0]);
        }
        return res.build();
    }
}
