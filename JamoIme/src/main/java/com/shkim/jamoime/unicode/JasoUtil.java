package com.shkim.jamoime.unicode;

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang.Validate;

/**
 * 한글의 자소를 다루는 클래스.
 * <p>
 * Code point arithmetic between the three Unicode blocks the engine touches:
 * combining Hangul Jamo (U+1100..U+11FF, used inside automaton display strings),
 * Hangul Compatibility Jamo (U+3130..U+318F, used to show an isolated jamo)
 * and precomposed Hangul Syllables (U+AC00..U+D7A3).
 *
 * @author kblee
 */
public final class JasoUtil {

  public static final int SYLLABLE_BASE = 0xAC00;
  public static final int SYLLABLE_LAST = 0xD7A3;
  public static final int LEAD_BASE = 0x1100;
  public static final int VOWEL_BASE = 0x1161;
  public static final int TRAIL_BASE = 0x11A7;

  public static final int LEAD_COUNT = 19;
  public static final int VOWEL_COUNT = 21;
  // including "no trail" at index 0
  public static final int TRAIL_COUNT = 28;
  public static final int SYLLABLES_PER_LEAD = VOWEL_COUNT * TRAIL_COUNT;

  // ㄱ ㄲ ㄴ ㄷ ㄸ ㄹ ㅁ ㅂ ㅃ ㅅ ㅆ ㅇ ㅈ ㅉ ㅊ ㅋ ㅌ ㅍ ㅎ
  static final char[] ChoSung = { 0x3131, 0x3132, 0x3134, 0x3137, 0x3138, 0x3139, 0x3141, 0x3142, 0x3143, 0x3145,
      0x3146, 0x3147, 0x3148, 0x3149, 0x314a, 0x314b, 0x314c, 0x314d, 0x314e };
  // ㅏ ㅐ ㅑ ㅒ ㅓ ㅔ ㅕ ㅖ ㅗ ㅘ ㅙ ㅚ ㅛ ㅜ ㅝ ㅞ ㅟ ㅠ ㅡ ㅢ ㅣ
  static final char[] JwungSung = { 0x314f, 0x3150, 0x3151, 0x3152, 0x3153, 0x3154, 0x3155, 0x3156, 0x3157, 0x3158,
      0x3159, 0x315a, 0x315b, 0x315c, 0x315d, 0x315e, 0x315f, 0x3160, 0x3161, 0x3162, 0x3163 };
  // ㄱ ㄲ ㄳ ㄴ ㄵ ㄶ ㄷ ㄹ ㄺ ㄻ ㄼ ㄽ ㄾ ㄿ ㅀ ㅁ ㅂ ㅄ ㅅ ㅆ ㅇ ㅈ ㅊ ㅋ ㅌ ㅍ ㅎ
  static final char[] JongSung = { 0, 0x3131, 0x3132, 0x3133, 0x3134, 0x3135, 0x3136, 0x3137, 0x3139, 0x313a, 0x313b,
      0x313c, 0x313d, 0x313e, 0x313f, 0x3140, 0x3141, 0x3142, 0x3144, 0x3145, 0x3146, 0x3147, 0x3148, 0x314a, 0x314b,
      0x314c, 0x314d, 0x314e };

  // 아래아: ᆞ -> ㆍ
  private static final int ARAEA = 0x119E;
  private static final int ARAEA_COMPATIBILITY = 0x318D;

  /**
   * 조합형 자모 -> 호환 자모
   */
  private static final Map<Integer, Integer> jamoToCompatibility = new HashMap<>();

  static {
    for (int i = 0; i < ChoSung.length; i++) {
      jamoToCompatibility.put(LEAD_BASE + i, (int) ChoSung[i]);
    }
    for (int i = 0; i < JwungSung.length; i++) {
      jamoToCompatibility.put(VOWEL_BASE + i, (int) JwungSung[i]);
    }
    for (int i = 1; i < JongSung.length; i++) {
      jamoToCompatibility.put(TRAIL_BASE + i, (int) JongSung[i]);
    }
    jamoToCompatibility.put(ARAEA, ARAEA_COMPATIBILITY);
  }

  private JasoUtil() {
  }

  /**
   * Maps a single combining jamo code point to its compatibility jamo.
   * Any other code point is returned unchanged.
   *
   * @param codePoint int
   * @return the compatibility code point, or the argument itself if there is no mapping
   */
  public static int toCompatibilityJamo(int codePoint) {
    Integer res = jamoToCompatibility.get(codePoint);
    return res == null ? codePoint : res;
  }

  /**
   * Maps every code point of the given string through {@link #toCompatibilityJamo(int)}.
   *
   * @param jamo String, not null
   * @return String
   */
  public static String toCompatibilityJamo(String jamo) {
    Validate.notNull(jamo, "Null jamo string");
    StringBuilder res = new StringBuilder(jamo.length());
    jamo.codePoints().map(JasoUtil::toCompatibilityJamo).forEach(res::appendCodePoint);
    return res.toString();
  }

  /**
   * Assembles a precomposed syllable: {@code 0xAC00 + lead * 588 + vowel * 28 + trail}.
   *
   * @param lead  int, 0..18
   * @param vowel int, 0..20
   * @param trail int, 0..27, zero for no trailing consonant
   * @return char from U+AC00..U+D7A3
   */
  public static char composeSyllable(int lead, int vowel, int trail) {
    Validate.isTrue(lead >= 0 && lead < LEAD_COUNT, "Wrong lead index: " + lead);
    Validate.isTrue(vowel >= 0 && vowel < VOWEL_COUNT, "Wrong vowel index: " + vowel);
    Validate.isTrue(trail >= 0 && trail < TRAIL_COUNT, "Wrong trail index: " + trail);
    return (char) (SYLLABLE_BASE + lead * SYLLABLES_PER_LEAD + vowel * TRAIL_COUNT + trail);
  }

  /**
   * Splits a precomposed syllable into its (lead, vowel, trail) indices.
   *
   * @param syllable char, a precomposed Hangul syllable
   * @return int array of size 3, trail index is zero if there is no trailing consonant
   */
  public static int[] decomposeSyllable(char syllable) {
    Validate.isTrue(isSyllable(syllable), "Not a hangul syllable: " + syllable);
    int offset = syllable - SYLLABLE_BASE;
    return new int[]{offset / SYLLABLES_PER_LEAD, (offset % SYLLABLES_PER_LEAD) / TRAIL_COUNT, offset % TRAIL_COUNT};
  }

  public static boolean isSyllable(int codePoint) {
    return codePoint >= SYLLABLE_BASE && codePoint <= SYLLABLE_LAST;
  }
}
