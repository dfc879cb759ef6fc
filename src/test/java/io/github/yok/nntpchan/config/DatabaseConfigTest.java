package io.github.yok.nntpchan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class DatabaseConfigTest {

    @Test
    void toJdbcUrl_正常ケース_デフォルト設定を指定する_UNIXソケットURLが返ること() {
        DatabaseConfig config = new DatabaseConfig();
        assertTrue(config.isUnixSocket());
        assertEquals("jdbc:postgresql://localhost/postgres?socketFactory="
                + DatabaseConfig.UNIX_SOCKET_FACTORY
                + "&socketFactoryArg=/var/run/postgresql/.s.PGSQL.5432", config.toJdbcUrl());
    }

    @Test
    void toJdbcUrl_正常ケース_ソケットディレクトリ末尾スラッシュありを指定する_スラッシュが重複しないこと() {
        DatabaseConfig config = new DatabaseConfig();
        config.setHost("/tmp/pg/");
        config.setPort(5433);
        assertTrue(config.toJdbcUrl().endsWith("socketFactoryArg=/tmp/pg/.s.PGSQL.5433"));
    }

    @Test
    void toJdbcUrl_正常ケース_PostgreSQLホストを指定する_TCP接続URLが返ること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setHost("db.internal");
        config.setName("chan");
        assertFalse(config.isUnixSocket());
        assertEquals("jdbc:postgresql://db.internal:5432/chan", config.toJdbcUrl());
    }

    @Test
    void toJdbcUrl_正常ケース_前後空白付きのホストと名前を指定する_トリムされたURLが返ること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setHost(" db ");
        config.setName(" chan ");
        assertEquals("db", config.getHost());
        assertEquals("jdbc:postgresql://db:5432/chan", config.toJdbcUrl());
    }

    @Test
    void toJdbcUrl_正常ケース_MySQLを指定する_デフォルトポートのURLが返ること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setEngine(DatabaseEngine.MYSQL);
        config.setHost("localhost");
        config.setName("chan");
        assertEquals("jdbc:mysql://localhost:3306/chan", config.toJdbcUrl());
    }

    @Test
    void toJdbcUrl_正常ケース_SQLServerを指定する_databaseName付きURLが返ること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setEngine(DatabaseEngine.SQLSERVER);
        config.setHost("mssql");
        config.setName("chan");
        assertEquals("jdbc:sqlserver://mssql:1433;databaseName=chan", config.toJdbcUrl());
    }

    @Test
    void toJdbcUrl_正常ケース_Oracleを指定する_サービス名URLが返ること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setEngine(DatabaseEngine.ORACLE);
        config.setHost("ora");
        config.setPort(1522);
        config.setName("XEPDB1");
        assertEquals("jdbc:oracle:thin:@//ora:1522/XEPDB1", config.toJdbcUrl());
    }

    @Test
    void toJdbcUrl_異常ケース_MySQLでソケットディレクトリを指定する_IllegalStateExceptionが送出されること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setEngine(DatabaseEngine.MYSQL);
        assertThrows(IllegalStateException.class, config::toJdbcUrl);
    }

    @Test
    void toJdbcUrl_異常ケース_name空文字を指定する_IllegalStateExceptionが送出されること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setName(" ");
        assertThrows(IllegalStateException.class, config::toJdbcUrl);
    }

    @Test
    void toJdbcUrl_異常ケース_host未設定を指定する_IllegalStateExceptionが送出されること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setHost(null);
        assertThrows(IllegalStateException.class, config::toJdbcUrl);
    }

    @Test
    void effectivePort_異常ケース_engine未設定でport未設定を指定する_IllegalStateExceptionが送出されること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setEngine(null);
        assertThrows(IllegalStateException.class, config::effectivePort);
    }

    @Test
    void effectivePort_正常ケース_port指定ありを指定する_指定値が返ること() {
        DatabaseConfig config = new DatabaseConfig();
        config.setPort(6543);
        assertEquals(6543, config.effectivePort());
    }
}
