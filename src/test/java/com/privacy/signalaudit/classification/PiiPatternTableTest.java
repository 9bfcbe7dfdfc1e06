package com.privacy.signalaudit.classification;

import com.privacy.signalaudit.config.ClassificationConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PiiPatternTableTest {

    private final PiiPatternTable table = new PiiPatternTable(new ClassificationConfig());

    @Test
    void match_emailInQuery() {
        assertThat(table.match("https://t.example/p?e=jane.doe@example.com")).contains("email");
    }

    @Test
    void match_identifierParameters() {
        assertThat(table.match("https://t.example/p?uid=123&x=1")).contains("uid_param");
        assertThat(table.match("https://t.example/p?a=1&user_id=abc")).contains("user_id_param");
        assertThat(table.match("https://t.example/p?phone=5551234")).contains("phone_param");
        assertThat(table.match("https://t.example/p?first_name=Jane")).contains("name_param");
    }

    @Test
    void match_hashedIdentifiers() {
        String sha256 = "a".repeat(64);
        assertThat(table.match("https://t.example/p?sha256=" + sha256)).contains("sha256_param", "hashed_id");
        assertThat(table.match("https://t.example/p?h=" + "0123456789abcdef".repeat(2))).contains("hashed_id");
    }

    @Test
    void match_ipv4Literal() {
        assertThat(table.match("https://t.example/p?ip=192.168.10.20")).contains("ipv4");
    }

    @Test
    void match_cleanUrl_returnsEmpty() {
        assertThat(table.match("https://cdn.example.com/app.js?v=3")).isEmpty();
    }

    @Test
    void match_resultFollowsTableOrder() {
        PiiPatternTable ordered = new PiiPatternTable(Map.of("only", "secret"));
        assertThat(ordered.match("https://x.example/?q=SECRET")).containsExactly("only");
    }

    @Test
    void invalidPattern_rejectedAtConstruction() {
        assertThatThrownBy(() -> new PiiPatternTable(Map.of("broken", "([a-z")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("broken");
    }
}
