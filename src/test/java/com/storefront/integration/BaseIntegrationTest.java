package com.storefront.integration;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * 통합 테스트 기본 클래스 - TestContainers MySQL 8
 *
 * - 컨테이너는 JVM당 한 번만 시작해서 모든 통합 테스트 클래스가 공유한다
 *   (Spring 컨텍스트 캐시가 같은 datasource URL을 계속 쓰기 때문)
 * - Docker가 없으면 테스트 클래스 전체를 건너뛴다
 * - 동시성 테스트가 커밋된 데이터를 봐야 하므로 @Transactional 롤백 대신
 *   매 테스트 전에 테이블을 비운다
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {

    private static MySQLContainer<?> mysql;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        MySQLContainer<?> container = mysqlContainer();
        registry.add("spring.datasource.url", container::getJdbcUrl);
        registry.add("spring.datasource.username", container::getUsername);
        registry.add("spring.datasource.password", container::getPassword);
    }

    private static synchronized MySQLContainer<?> mysqlContainer() {
        if (mysql == null) {
            mysql = new MySQLContainer<>("mysql:8.0.36")
                    .withDatabaseName("storefront_test")
                    .withUsername("testuser")
                    .withPassword("testpass")
                    .withCommand(
                        "--character-set-server=utf8mb4",
                        "--collation-server=utf8mb4_unicode_ci",
                        "--innodb-lock-wait-timeout=10"
                    );
            mysql.start();
        }
        return mysql;
    }

    @BeforeEach
    void cleanUpTables() {
        jdbcTemplate.execute("DELETE FROM order_items");
        jdbcTemplate.execute("DELETE FROM orders");
        jdbcTemplate.execute("DELETE FROM products");
        jdbcTemplate.execute("DELETE FROM users");
    }

    protected int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    protected int stockOf(Long productId) {
        Integer stock = jdbcTemplate.queryForObject("SELECT stock FROM products WHERE id = ?", Integer.class, productId);
        return stock == null ? 0 : stock;
    }
}
