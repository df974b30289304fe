package com.starscape.todoapp.integration;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * End-to-end HTTP flow against the in-memory backend.
 */
@ActiveProfiles("memory")
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "app.security.password.strength=4",
                "app.security.jwt.secret=flow-test-secret-that-is-at-least-32-bytes"
        })
class TodoApiFlowTest {

    private static final String PASSWORD = "password123";

    @LocalServerPort
    private int port;

    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
    }

    @Test
    @DirtiesContext(methodMode = DirtiesContext.MethodMode.BEFORE_METHOD)
    void registerLoginCreateListDeleteOnFreshInstance() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("email", "user@x.com", "password", PASSWORD))
                .post("/api/auth/register")
                .then()
                .statusCode(201)
                .body("id", equalTo(1))
                .body("email", equalTo("user@x.com"))
                .body("created_at", notNullValue())
                .body("$", not(hasKey("password_hash")));

        String token = login("user@x.com", PASSWORD);

        given()
                .header("Authorization", "Bearer " + token)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "Buy milk"))
                .post("/api/todos")
                .then()
                .statusCode(201)
                .body("id", equalTo(1))
                .body("title", equalTo("Buy milk"))
                .body("description", equalTo(""))
                .body("status", equalTo("pending"))
                .body("owner_id", equalTo(1));

        given()
                .header("Authorization", "Bearer " + token)
                .get("/api/todos")
                .then()
                .statusCode(200)
                .body("$", hasSize(1))
                .body("[0].title", equalTo("Buy milk"));

        given()
                .header("Authorization", "Bearer " + token)
                .delete("/api/todos/1")
                .then()
                .statusCode(204);

        given()
                .header("Authorization", "Bearer " + token)
                .get("/api/todos/1")
                .then()
                .statusCode(404)
                .body("code", equalTo("NOT_FOUND"));
    }

    @Test
    void shortPasswordIsRejected() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("email", uniqueEmail(), "password", "short"))
                .post("/api/auth/register")
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"))
                .body("message", equalTo("Password must be at least 8 characters"));
    }

    @Test
    void duplicateEmailConflictsRegardlessOfCase() {
        String email = uniqueEmail();
        register(email);

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("email", "  " + email.toUpperCase() + " ", "password", PASSWORD))
                .post("/api/auth/register")
                .then()
                .statusCode(409)
                .body("message", equalTo("Email already registered"));
    }

    @Test
    void loginNormalizesEmail() {
        String email = uniqueEmail();
        register(email.toUpperCase());

        login(email + " ", PASSWORD);
    }

    @Test
    void wrongPasswordAndUnknownEmailFailIdentically() {
        String email = uniqueEmail();
        register(email);

        List<Map<String, String>> attempts = List.of(
                Map.of("email", email, "password", "wrong-password"),
                Map.of("email", uniqueEmail(), "password", PASSWORD));
        for (Map<String, String> body : attempts) {
            given()
                    .contentType(ContentType.JSON)
                    .body(body)
                    .post("/api/auth/login")
                    .then()
                    .statusCode(401)
                    .header("WWW-Authenticate", "Bearer")
                    .body("message", equalTo("Incorrect email or password"));
        }
    }

    @Test
    void protectedRoutesRequireValidBearerToken() {
        given()
                .get("/api/todos")
                .then()
                .statusCode(401)
                .header("WWW-Authenticate", "Bearer")
                .body("code", equalTo("UNAUTHORIZED"));

        given()
                .header("Authorization", "Bearer not.a.jwt")
                .get("/api/todos")
                .then()
                .statusCode(401);

        given()
                .header("Authorization", "Bearer ")
                .get("/api/auth/me")
                .then()
                .statusCode(401);
    }

    @Test
    void meReturnsTheTokenOwner() {
        String email = uniqueEmail();
        String token = registerAndLogin(email);

        given()
                .header("Authorization", "Bearer " + token)
                .get("/api/auth/me")
                .then()
                .statusCode(200)
                .body("email", equalTo(email))
                .body("id", greaterThan(0));
    }

    @Test
    void foreignItemsLookMissing() {
        String alice = registerAndLogin(uniqueEmail());
        String bob = registerAndLogin(uniqueEmail());
        int itemId = createTodo(alice, "alice's secret");

        given().header("Authorization", "Bearer " + bob)
                .get("/api/todos/" + itemId)
                .then().statusCode(404);
        given().header("Authorization", "Bearer " + bob)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "hijacked"))
                .put("/api/todos/" + itemId)
                .then().statusCode(404);
        given().header("Authorization", "Bearer " + bob)
                .patch("/api/todos/" + itemId + "/complete")
                .then().statusCode(404);
        given().header("Authorization", "Bearer " + bob)
                .delete("/api/todos/" + itemId)
                .then().statusCode(404);
        given().header("Authorization", "Bearer " + bob)
                .get("/api/todos")
                .then().statusCode(200).body("$", empty());

        given().header("Authorization", "Bearer " + alice)
                .get("/api/todos/" + itemId)
                .then()
                .statusCode(200)
                .body("title", equalTo("alice's secret"))
                .body("status", equalTo("pending"));
    }

    @Test
    void completingTwiceIsHarmless() {
        String token = registerAndLogin(uniqueEmail());
        int itemId = createTodo(token, "chore");

        for (int i = 0; i < 2; i++) {
            given().header("Authorization", "Bearer " + token)
                    .patch("/api/todos/" + itemId + "/complete")
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("complete"));
        }
    }

    @Test
    void updateKeepsOmittedFields() {
        String token = registerAndLogin(uniqueEmail());
        int itemId = given()
                .header("Authorization", "Bearer " + token)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "title", "description", "keep me"))
                .post("/api/todos")
                .then().statusCode(201)
                .extract().path("id");

        given().header("Authorization", "Bearer " + token)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "  renamed  "))
                .put("/api/todos/" + itemId)
                .then()
                .statusCode(200)
                .body("title", equalTo("renamed"))
                .body("description", equalTo("keep me"));

        given().header("Authorization", "Bearer " + token)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "   "))
                .put("/api/todos/" + itemId)
                .then()
                .statusCode(400)
                .body("message", equalTo("Title cannot be empty or whitespace-only"));
    }

    @Test
    void invalidCreateRequestsAreRejected() {
        String token = registerAndLogin(uniqueEmail());

        given().header("Authorization", "Bearer " + token)
                .contentType(ContentType.JSON)
                .body(Map.of("description", "no title"))
                .post("/api/todos")
                .then()
                .statusCode(400)
                .body("details.title", equalTo("Title is required"));

        given().header("Authorization", "Bearer " + token)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "x".repeat(501)))
                .post("/api/todos")
                .then()
                .statusCode(400)
                .body("message", equalTo("Title cannot exceed 500 characters"));
    }

    @Test
    void nonNumericIdIsNotFound() {
        String token = registerAndLogin(uniqueEmail());

        given().header("Authorization", "Bearer " + token)
                .get("/api/todos/abc")
                .then()
                .statusCode(404);
    }

    @Test
    void taskSuffixUnderTodosIsNotARoute() {
        String token = registerAndLogin(uniqueEmail());

        given().header("Authorization", "Bearer " + token)
                .get("/api/todos/tasks")
                .then()
                .statusCode(404)
                .body("code", equalTo("NOT_FOUND"));
    }

    @Test
    void taskRoutesIgnoreClaimedOwner() {
        String token = registerAndLogin(uniqueEmail());
        int ownerId = given()
                .header("Authorization", "Bearer " + token)
                .get("/api/auth/me")
                .then().statusCode(200)
                .extract().path("id");

        int itemId = given()
                .header("Authorization", "Bearer " + token)
                .contentType(ContentType.JSON)
                .body(Map.of("title", "via tasks", "owner_id", 999999))
                .post("/api/999999/tasks")
                .then()
                .statusCode(201)
                .body("owner_id", equalTo(ownerId))
                .extract().path("id");

        given().header("Authorization", "Bearer " + token)
                .get("/api/todos/" + itemId)
                .then()
                .statusCode(200)
                .body("title", equalTo("via tasks"));

        given().header("Authorization", "Bearer " + token)
                .patch("/api/12345/tasks/" + itemId + "/complete")
                .then()
                .statusCode(200)
                .body("status", equalTo("complete"));
    }

    @Test
    void healthEndpointIsPublic() {
        given()
                .get("/")
                .then()
                .statusCode(200)
                .body("status", equalTo("ok"))
                .body("message", equalTo("Todo API is running"));
    }

    private static String uniqueEmail() {
        return "flow-" + System.nanoTime() + "@example.com";
    }

    private static void register(String email) {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("email", email, "password", PASSWORD))
                .post("/api/auth/register")
                .then()
                .statusCode(201);
    }

    private static String login(String email, String password) {
        return given()
                .contentType(ContentType.JSON)
                .body(Map.of("email", email, "password", password))
                .post("/api/auth/login")
                .then()
                .statusCode(200)
                .body("token_type", equalTo("bearer"))
                .body("expires_in", equalTo(86400))
                .extract()
                .path("access_token");
    }

    private static String registerAndLogin(String email) {
        register(email);
        return login(email, PASSWORD);
    }

    private static int createTodo(String token, String title) {
        return given()
                .header("Authorization", "Bearer " + token)
                .contentType(ContentType.JSON)
                .body(Map.of("title", title))
                .post("/api/todos")
                .then()
                .statusCode(201)
                .extract()
                .path("id");
    }
}
