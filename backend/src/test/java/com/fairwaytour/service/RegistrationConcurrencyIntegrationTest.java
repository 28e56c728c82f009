package com.fairwaytour.service;

import com.fairwaytour.dto.RegistrationResponses;
import com.fairwaytour.model.RegistrationMode;
import com.fairwaytour.web.ConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.jpa.hibernate.ddl-auto=validate",
        "spring.flyway.enabled=true",
        "spring.flyway.locations=classpath:db/migration"
})
@Testcontainers(disabledWithoutDocker = true)
class RegistrationConcurrencyIntegrationTest {

    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000924");
    private static final UUID AVERY = UUID.fromString("00000000-0000-0000-0000-000000000931");
    private static final UUID BLAKE = UUID.fromString("00000000-0000-0000-0000-000000000932");
    private static final UUID CASEY = UUID.fromString("00000000-0000-0000-0000-000000000933");

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private RegistrationService registrationService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void seedCompetition() {
        jdbcTemplate.execute("""
                TRUNCATE TABLE
                    final_results,
                    competition_category_tees,
                    registrations,
                    participants,
                    tee_times,
                    competitions,
                    course_tees,
                    tour_enrollments,
                    tour_categories,
                    tours,
                    point_templates,
                    players
                CASCADE
                """);
        jdbcTemplate.update("INSERT INTO players (player_id, name, handicap_index) VALUES (?, ?, ?)", AVERY, "Avery", 4.2);
        jdbcTemplate.update("INSERT INTO players (player_id, name, handicap_index) VALUES (?, ?, ?)", BLAKE, "Blake", 12.0);
        jdbcTemplate.update("INSERT INTO players (player_id, name, handicap_index) VALUES (?, ?, ?)", CASEY, "Casey", 20.0);
        jdbcTemplate.update("""
                        INSERT INTO competitions (competition_id, name, competition_date, scoring_mode, start_mode)
                        VALUES (?, ?, CURRENT_DATE, 'GROSS', 'OPEN')
                        """,
                COMPETITION_ID,
                "Friday Roll-up"
        );
    }

    @Test
    void sameLookingForGroupPlayerJoinsOnlyOneOfTwoCompetingGroups() throws Exception {
        RegistrationResponses.Registration avery = registrationService.register(COMPETITION_ID, AVERY, RegistrationMode.SOLO);
        RegistrationResponses.Registration blake = registrationService.register(COMPETITION_ID, BLAKE, RegistrationMode.SOLO);
        registrationService.register(COMPETITION_ID, CASEY, RegistrationMode.LOOKING_FOR_GROUP);

        CountDownLatch startGate = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<RegistrationResponses.PlayingGroup>> attempts = new ArrayList<>();
        try {
            for (UUID creator : List.of(AVERY, BLAKE)) {
                Callable<RegistrationResponses.PlayingGroup> attempt = () -> {
                    startGate.await();
                    return registrationService.addToGroup(COMPETITION_ID, creator, List.of(CASEY));
                };
                attempts.add(executor.submit(attempt));
            }
            startGate.countDown();

            int successes = 0;
            int conflicts = 0;
            UUID winningTeeTime = null;
            for (Future<RegistrationResponses.PlayingGroup> attempt : attempts) {
                try {
                    RegistrationResponses.PlayingGroup group = attempt.get(30, TimeUnit.SECONDS);
                    successes++;
                    winningTeeTime = group.teeTimeId();
                } catch (ExecutionException ex) {
                    assertTrue(
                            ex.getCause() instanceof ConflictException
                                    || ex.getCause() instanceof ConcurrencyFailureException,
                            () -> "unexpected failure: " + ex.getCause()
                    );
                    conflicts++;
                }
            }

            assertEquals(1, successes);
            assertEquals(1, conflicts);
            assertTrue(winningTeeTime.equals(avery.teeTimeId()) || winningTeeTime.equals(blake.teeTimeId()));
            assertEquals(winningTeeTime, registrationService.getRegistration(COMPETITION_ID, CASEY).teeTimeId());
            Integer caseyParticipants = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM participants WHERE competition_id = ? AND player_id = ?",
                    Integer.class,
                    COMPETITION_ID,
                    CASEY
            );
            assertEquals(1, caseyParticipants);
        } finally {
            executor.shutdownNow();
        }
    }
}
