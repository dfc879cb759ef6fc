package io.github.yok.nntpchan.hosts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AllowedHostsMatcherTest {

    @Test
    void isAllowed_正常ケース_完全一致パターンを指定する_同一ホストのみ許可されること() {
        AllowedHostsMatcher matcher = new AllowedHostsMatcher(List.of("ebin.tld"), false);
        assertTrue(matcher.isAllowed("ebin.tld"));
        assertTrue(matcher.isAllowed("EBIN.TLD"));
        assertTrue(matcher.isAllowed("ebin.tld:8080"));
        assertTrue(matcher.isAllowed("ebin.tld."));
        assertFalse(matcher.isAllowed("www.ebin.tld"));
    }

    @Test
    void isAllowed_正常ケース_ドット始まりパターンを指定する_ドメインとサブドメインが許可されること() {
        AllowedHostsMatcher matcher = new AllowedHostsMatcher(List.of(".ebin.tld"), false);
        assertTrue(matcher.isAllowed("ebin.tld"));
        assertTrue(matcher.isAllowed("board.ebin.tld"));
        assertTrue(matcher.isAllowed("a.b.ebin.tld:443"));
        assertFalse(matcher.isAllowed("notebin.tld"));
    }

    @Test
    void isAllowed_正常ケース_ワイルドカードを指定する_全ホストが許可されること() {
        AllowedHostsMatcher matcher = new AllowedHostsMatcher(List.of("*"), false);
        assertTrue(matcher.isAllowed("anything.example"));
    }

    @Test
    void isAllowed_正常ケース_debugで空リストを指定する_ループバックのみ許可されること() {
        AllowedHostsMatcher matcher = new AllowedHostsMatcher(List.of(), true);
        assertEquals(AllowedHostsMatcher.DEBUG_LOOPBACK_HOSTS, matcher.getPatterns());
        assertTrue(matcher.isAllowed("localhost:8000"));
        assertTrue(matcher.isAllowed("127.0.0.1"));
        assertTrue(matcher.isAllowed("[::1]:8000"));
        assertFalse(matcher.isAllowed("ebin.tld"));
    }

    @Test
    void isAllowed_正常ケース_非debugで空リストを指定する_全ホストが拒否されること() {
        AllowedHostsMatcher matcher = new AllowedHostsMatcher(null, false);
        assertTrue(matcher.getPatterns().isEmpty());
        assertFalse(matcher.isAllowed("localhost"));
    }

    @Test
    void isAllowed_正常ケース_debugでパターン指定ありを指定する_ループバックが追加されないこと() {
        AllowedHostsMatcher matcher = new AllowedHostsMatcher(Arrays.asList("ebin.tld", " "), true);
        assertEquals(List.of("ebin.tld"), matcher.getPatterns());
        assertFalse(matcher.isAllowed("localhost"));
    }

    @Test
    void isAllowed_異常ケース_空ホストを指定する_拒否されること() {
        AllowedHostsMatcher matcher = new AllowedHostsMatcher(List.of("*"), false);
        assertFalse(matcher.isAllowed(null));
        assertFalse(matcher.isAllowed(" "));
        assertFalse(matcher.isAllowed(":80"));
    }

    @Test
    void stripPort_異常ケース_閉じ括弧なしIPv6を指定する_nullが返ること() {
        assertNull(AllowedHostsMatcher.stripPort("[::1"));
    }
}
