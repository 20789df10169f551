package json.ecma;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonQuoterTest extends EcmaJsonTestBase {

    @Test
    void testPlainStringIsOnlyWrapped() {
        assertThat(JsonQuoter.quote("")).isEqualTo("\"\"");
        assertThat(JsonQuoter.quote("hello world")).isEqualTo("\"hello world\"");
        assertThat(JsonQuoter.quote("caf\u00e9 \u4e2d")).isEqualTo("\"caf\u00e9 \u4e2d\"");
    }

    @Test
    void testShortEscapes() {
        assertThat(JsonQuoter.quote("a\"b")).isEqualTo("\"a\\\"b\"");
        assertThat(JsonQuoter.quote("a\\b")).isEqualTo("\"a\\\\b\"");
        assertThat(JsonQuoter.quote("\b\f\n\r\t")).isEqualTo("\"\\b\\f\\n\\r\\t\"");
        assertThat(JsonQuoter.quote("/")).isEqualTo("\"/\"");
    }

    @Test
    void testControlCharactersUseLowercaseHex() {
        assertThat(JsonQuoter.quote("\u0000")).isEqualTo("\"\\u0000\"");
        assertThat(JsonQuoter.quote("x\u001by")).isEqualTo("\"x\\u001by\"");
        assertThat(JsonQuoter.quote("\u007f")).isEqualTo("\"\u007f\"");
    }

    @Test
    void testSurrogates() {
        assertThat(JsonQuoter.quote("\ud834\udd1e")).isEqualTo("\"\ud834\udd1e\"");
        assertThat(JsonQuoter.quote("\ud834")).isEqualTo("\"\\ud834\"");
        assertThat(JsonQuoter.quote("\udd1e")).isEqualTo("\"\\udd1e\"");
        assertThat(JsonQuoter.quote("\udd1e\ud834")).isEqualTo("\"\\udd1e\\ud834\"");
        assertThat(JsonQuoter.quote("\ud834\ud834\udd1e")).isEqualTo("\"\\ud834\ud834\udd1e\"");
        assertThat(JsonQuoter.quote("a\ud834\"")).isEqualTo("\"a\\ud834\\\"\"");
    }

    @Test
    void testAppendingForm() {
        final StringBuilder sb = new StringBuilder("x=");
        JsonQuoter.quote("\n", sb);
        JsonQuoter.quote("ok", sb);

        assertThat(sb.toString()).isEqualTo("x=\"\\n\"\"ok\"");
    }
}
