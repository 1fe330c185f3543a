package villagecompute.campus.api.rest;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.campus.TestFixtures;
import villagecompute.campus.data.models.ScheduledJob;
import villagecompute.campus.jobs.ScheduleType;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Tests for {@link ScheduledJobTriggerResource}.
 */
@QuarkusTest
class ScheduledJobTriggerResourceTest {

    private static final String TOKEN = "test-trigger-token";

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    @Test
    void testRejectsMissingToken() {
        given().when().post("/api/scheduled-jobs/execute").then().statusCode(401).body("error",
                equalTo("Invalid scheduler token"));
    }

    @Test
    void testRejectsWrongToken() {
        given().header("X-Scheduler-Token", "nope").when().post("/api/scheduled-jobs/execute").then()
                .statusCode(401);
    }

    @Test
    void testNothingDue() {
        given().header("X-Scheduler-Token", TOKEN).when().post("/api/scheduled-jobs/execute").then().statusCode(200)
                .body("total", equalTo(0)).body("executed", hasSize(0)).body("errors", hasSize(0))
                .body("timestamp", notNullValue());
    }

    @Test
    void testRunsDueJobsAndReportsFailures() {
        ScheduledJob due = TestFixtures.createJob("Auto-block", "VoucherAutoBlockJob", ScheduleType.DAILY, null, null,
                null, true);
        ScheduledJob broken = TestFixtures.createJob("Legacy", "LegacyJob", ScheduleType.DAILY, null, null, null,
                true);

        given().header("X-Scheduler-Token", TOKEN).when().post("/api/scheduled-jobs/execute").then().statusCode(200)
                .body("total", equalTo(1)).body("executed[0].id", equalTo(due.id.intValue()))
                .body("executed[0].status", equalTo("success")).body("errors[0].id", equalTo(broken.id.intValue()))
                .body("errors[0].error", equalTo("Unknown job class: LegacyJob"));
    }
}
