package papyri.d5.converter.normalize;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps precomposed Greek letterforms onto an undiacritized capital alphabet and strips editorial punctuation.
 */
public final class MajusculeNormalizer {

    private static final String INPUT_ALPHABET =
            "ΌΏΎΊΉᾲᾀᾁᾂᾃᾅᾇέάΐήώίόύϝϛϋϊᾄᾆᾳᾴᾷαβγδεζηθικλμνξοπρστυφχψωἀἄἂἆἁἅἃἇάὰᾶ"
            + "ἐἔἒἑἕἓὲέἠἤἢἦἡἥἣἧὴήᾐᾑᾒᾓᾔᾕᾖᾗῂῃῄῆῇἰἴἲἶἱἵἳἷὶίῐῑῒΐῖῗὀὄὂὁὅὃὸόὐὑὒὓὔὕὖὗὺ"
            + "ῦύῠῡῢΰῧὠὤὢὦὡὥὣὧώὼᾠᾡᾢᾣᾤᾥᾦᾧῲῳῴῶῷῤῥἈἌἊἎἉἍἋἏᾺΆᾼᾈᾉᾊᾋᾌᾍᾎᾏἘἜἚἙἝἛῈΈἨἬἪἮἩ"
            + "ἭἫἯῊΉῌᾘᾙᾚᾛᾜᾝᾞᾟἸἼἺἾἹἽἻἿΊῚῘῙὈὌὊὉὍὋΌῸὙὝὛὟΎῪῨῩὨὬὪὮὩὭὫὯΏῺῼᾨᾩᾪᾫᾬᾭᾮᾯῬςϲ"
            + "Ϲ";

    private static final String OUTPUT_MAPPING =
            "ΟΩΥΙΗΑΑΑΑΑΑΑΕΑΙΗΩΙΟΥϜϚΥΙΑΑΑΑΑΑΒΓΔΕΖΗΘΙΚΛΜΝΞΟΠΡΣΤΥΦΧΨΩΑΑΑΑΑΑΑΑΑΑΑ"
            + "ΕΕΕΕΕΕΕΕΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΗΙΙΙΙΙΙΙΙΙΙΙΙΙΙΙΙΟΟΟΟΟΟΟΟΥΥΥΥΥΥΥΥΥ"
            + "ΥΥΥΥΥΥΥΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΡΡΑΑΑΑΑΑΑΑΑΑΑΑΑΑΑΑΑΑΑΕΕΕΕΕΕΕΕΗΗΗΗΗ"
            + "ΗΗΗΗΗΗΗΗΗΗΗΗΗΗΙΙΙΙΙΙΙΙΙΙΙΙΟΟΟΟΟΟΟΟΥΥΥΥΥΥΥΥΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΩΡΣΣ"
            + "Σ";

    /**
     * Every letter the normalizer can produce, i.e. the capitals plus digamma and stigma.
     */
    public static final String OUTPUT_ALPHABET = "ΑΒΓΔΕΖΗΘΙΚΛΜΝΞΟΠΡΣΤΥΦΧΨΩϚϜ";

    // apostrophes, interpuncts, structural brackets, input-only combining marks, newline and space
    private static final String STRIPPED =
            "\u02BC\u2020\u2219\u00B7\u2022{}()',;:.-\u23D1\u0306\u0342"
            + "\u1FBD\u1FBF\u1FCE\u1FDE\u1FFE`\u0384\u201C\u201D\u2019\u0313\u02BD\u2018\u230A\u230B\n ";

    private static final Map<Integer, Integer> MAPPING = buildMapping();

    private MajusculeNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        text.codePoints()
                .map(codePoint -> MAPPING.getOrDefault(codePoint, codePoint))
                .filter(codePoint -> STRIPPED.indexOf(codePoint) < 0)
                .forEach(normalized::appendCodePoint);
        return normalized.toString();
    }

    private static Map<Integer, Integer> buildMapping() {
        int[] from = INPUT_ALPHABET.codePoints().toArray();
        int[] to = OUTPUT_MAPPING.codePoints().toArray();
        if (from.length != to.length) {
            throw new IllegalStateException("Normalizer alphabets differ in length: " + from.length + " != " + to.length);
        }
        Map<Integer, Integer> mapping = new HashMap<>();
        for (int i = 0; i < from.length; i++) {
            mapping.put(from[i], to[i]);
        }
        return Map.copyOf(mapping);
    }
}
