package com.libragraph.nsm;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class TokenResourceTest {

    @AfterEach
    void tearDown() {
        FakeMarketplaceResource.failing = false;
        FakeMarketplaceResource.balance.set(500);
    }

    @Test
    void status_reportsBalance() {
        given()
                .when().get("/api/v1/tokens")
                .then()
                .statusCode(200)
                .body("availableTokens", greaterThanOrEqualTo(0))
                .body("licensed", is(true));
    }

    @Test
    void validate_replacesLocalBalance() {
        FakeMarketplaceResource.balance.set(321);

        given()
                .when().post("/api/v1/tokens/validate")
                .then()
                .statusCode(200)
                .body("availableTokens", is(321))
                .body("lastSync", is(FakeMarketplaceResource.LAST_SYNC));

        assertThat(FakeMarketplaceResource.lastAuthorization.get()).isEqualTo("Bearer test-license");
        given()
                .when().get("/api/v1/tokens")
                .then()
                .statusCode(200)
                .body("availableTokens", is(321));
    }

    @Test
    void validate_marketplaceFailure_keepsBalance() {
        int before = given().when().get("/api/v1/tokens").then().statusCode(200)
                .extract().path("availableTokens");
        FakeMarketplaceResource.failing = true;

        given()
                .when().post("/api/v1/tokens/validate")
                .then()
                .statusCode(502)
                .body("error", is("LICENSE_VALIDATION_FAILED"));

        given()
                .when().get("/api/v1/tokens")
                .then()
                .statusCode(200)
                .body("availableTokens", is(before));
    }

    @Test
    void purchase_returnsPaymentUrl() {
        int before = given().when().get("/api/v1/tokens").then().statusCode(200)
                .extract().path("availableTokens");

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("tokenCount", 25))
                .when().post("/api/v1/tokens/purchase")
                .then()
                .statusCode(200)
                .body("paymentUrl", is("https://pay.example.test/order/42"))
                .body("orderId", is("order-42"));

        assertThat(FakeMarketplaceResource.lastPurchaseCount.get()).isEqualTo(25);
        given()
                .when().get("/api/v1/tokens")
                .then()
                .body("availableTokens", is(before));
    }

    @Test
    void purchase_nonPositiveCount_isBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("tokenCount", 0))
                .when().post("/api/v1/tokens/purchase")
                .then()
                .statusCode(400)
                .body("error", is("BAD_REQUEST"));
    }
}
