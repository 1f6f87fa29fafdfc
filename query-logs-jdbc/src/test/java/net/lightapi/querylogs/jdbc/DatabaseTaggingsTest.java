package net.lightapi.querylogs.jdbc;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DatabaseTaggingsTest {

    @Test
    void testPostgres() {
        assertEquals(Map.of("db_host", "localhost", "database", "configserver"),
                DatabaseTaggings.fromJdbcUrl("jdbc:postgresql://localhost:5432/configserver?currentSchema=portal"));
    }

    @Test
    void testMysqlWithoutPort() {
        assertEquals(Map.of("db_host", "db.lightapi.net", "database", "portal"),
                DatabaseTaggings.fromJdbcUrl("jdbc:mysql://db.lightapi.net/portal"));
    }

    @Test
    void testSocket() {
        assertEquals(Map.of("db_host", "localhost", "database", "portal", "socket", "/var/run/mysqld/mysqld.sock"),
                DatabaseTaggings.fromJdbcUrl("jdbc:mysql://localhost/portal?useSSL=false&socket=/var/run/mysqld/mysqld.sock"));
        assertEquals("/tmp/mariadb.sock",
                DatabaseTaggings.fromJdbcUrl("jdbc:mariadb://localhost/portal?localSocket=%2Ftmp%2Fmariadb.sock").get("socket"));
        assertEquals("/tmp/mysqlx.sock",
                DatabaseTaggings.fromJdbcUrl("jdbc:mysql://localhost/portal?unixSocketPath=/tmp/mysqlx.sock").get("socket"));
    }

    @Test
    void testNoDatabase() {
        assertEquals(Map.of("db_host", "localhost"), DatabaseTaggings.fromJdbcUrl("jdbc:postgresql://localhost:5432/"));
    }

    @Test
    void testUnparseable() {
        assertTrue(DatabaseTaggings.fromJdbcUrl(null).isEmpty());
        assertTrue(DatabaseTaggings.fromJdbcUrl("jdbc:h2:mem:test").isEmpty());
        assertTrue(DatabaseTaggings.fromJdbcUrl("jdbc:oracle:thin:@dbhost:1521/ORCL").isEmpty());
        assertTrue(DatabaseTaggings.fromJdbcUrl("postgresql://localhost/portal").isEmpty());
    }
}
