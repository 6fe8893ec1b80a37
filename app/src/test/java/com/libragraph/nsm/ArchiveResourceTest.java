package com.libragraph.nsm;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class ArchiveResourceTest {

    @TempDir
    Path tmp;

    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        source = Files.createDirectories(tmp.resolve("docs"));
        Files.writeString(source.resolve("a.txt"), "hello world, the quick brown fox");
        Files.writeString(source.resolve("b.txt"), "goodbye world");
        Files.createDirectories(source.resolve("nested"));
        Files.writeString(source.resolve("nested/c.txt"), "fox fox fox");
    }

    @Test
    void create_chargesOneToken() {
        int before = availableTokens();

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("output", tmp.resolve("out.nsm").toString(), "inputs", List.of(source.toString())))
                .when().post("/api/v1/archives")
                .then()
                .statusCode(201)
                .body("entryCount", is(3))
                .body("compression", is("zstd"))
                .body("encrypted", is(false))
                .body("tokensRemaining", is(before - 1));

        assertThat(availableTokens()).isEqualTo(before - 1);
        assertThat(tmp.resolve("out.nsm")).exists();
        assertThat(tmp.resolve("out.nsm.partial")).doesNotExist();
    }

    @Test
    void search_rankedFromIndex() {
        Path archive = create("search.nsm", Map.of());

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", archive.toString(), "query", "fox"))
                .when().post("/api/v1/archives/search")
                .then()
                .statusCode(200)
                .body("fromIndex", is(true))
                .body("hits.path", contains("docs/nested/c.txt", "docs/a.txt"))
                .body("hits[0].matches", is(3));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", archive.toString(), "query", "orld", "substring", true))
                .when().post("/api/v1/archives/search")
                .then()
                .statusCode(200)
                .body("fromIndex", is(false))
                .body("hits.path", containsInAnyOrder("docs/a.txt", "docs/b.txt"));
    }

    @Test
    void extract_restoresContent() throws IOException {
        Path archive = create("extract.nsm", Map.of());
        Path dest = tmp.resolve("restored");

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", archive.toString(), "destination", dest.toString()))
                .when().post("/api/v1/archives/extract")
                .then()
                .statusCode(200)
                .body("complete", is(true))
                .body("extracted", hasSize(3));

        assertThat(Files.readString(dest.resolve("docs/a.txt"))).isEqualTo("hello world, the quick brown fox");
        assertThat(Files.readString(dest.resolve("docs/nested/c.txt"))).isEqualTo("fox fox fox");
    }

    @Test
    void extract_missingEntry_reportedPerEntry() {
        Path archive = create("partial.nsm", Map.of());

        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                        "archive", archive.toString(),
                        "paths", List.of("docs/b.txt", "docs/missing.txt"),
                        "destination", tmp.resolve("some").toString()))
                .when().post("/api/v1/archives/extract")
                .then()
                .statusCode(200)
                .body("complete", is(false))
                .body("extracted", contains("docs/b.txt"))
                .body("failures[0].path", is("docs/missing.txt"))
                .body("failures[0].error", is("ENTRY_NOT_FOUND"));
    }

    @Test
    void inspectAndVerify_describeArchive() {
        Path archive = create("inspect.nsm", Map.of("compression", "bzip2"));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", archive.toString()))
                .when().post("/api/v1/archives/inspect")
                .then()
                .statusCode(200)
                .body("version", is(2))
                .body("compression", is("bzip2"))
                .body("encryption", is("NONE"))
                .body("hasSearchIndex", is(true))
                .body("entries.path", contains("docs/a.txt", "docs/b.txt", "docs/nested/c.txt"))
                .body("entries[0].checksum", matchesPattern("[0-9a-f]{64}"));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", archive.toString()))
                .when().post("/api/v1/archives/verify")
                .then()
                .statusCode(200)
                .body("entries", hasSize(3));
    }

    @Test
    void verify_corruptedData_isUnprocessable() throws IOException {
        Path archive = create("corrupt.nsm", Map.of());
        try (RandomAccessFile raf = new RandomAccessFile(archive.toFile(), "rw")) {
            raf.seek(64);
            int b = raf.read();
            raf.seek(64);
            raf.write(b ^ 0x01);
        }

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", archive.toString()))
                .when().post("/api/v1/archives/verify")
                .then()
                .statusCode(422)
                .body("error", is("CHECKSUM_MISMATCH"));
    }

    @Test
    void inspect_notAnArchive_isUnprocessable() throws IOException {
        Path garbage = tmp.resolve("garbage.nsm");
        Files.write(garbage, "definitely not an archive, just some text that is long enough to read"
                .repeat(3).getBytes(StandardCharsets.UTF_8));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", garbage.toString()))
                .when().post("/api/v1/archives/inspect")
                .then()
                .statusCode(422)
                .body("error", is("INVALID_FORMAT"));
    }

    @Test
    void encrypted_roundTrip() throws IOException {
        Path archive = create("secret.nsm", Map.of("encrypt", true));
        Path dest = tmp.resolve("decrypted");

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", archive.toString()))
                .when().post("/api/v1/archives/inspect")
                .then()
                .statusCode(200)
                .body("encryption", is("AES_256_GCM"));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("archive", archive.toString(), "destination", dest.toString()))
                .when().post("/api/v1/archives/extract")
                .then()
                .statusCode(200)
                .body("complete", is(true));

        assertThat(Files.readString(dest.resolve("docs/b.txt"))).isEqualTo("goodbye world");
    }

    @Test
    void create_badRequests() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("output", tmp.resolve("none.nsm").toString(), "inputs", List.of()))
                .when().post("/api/v1/archives")
                .then()
                .statusCode(400)
                .body("error", is("BAD_REQUEST"));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                        "output", tmp.resolve("lz4.nsm").toString(),
                        "inputs", List.of(source.toString()),
                        "compression", "lz4"))
                .when().post("/api/v1/archives")
                .then()
                .statusCode(400);

        assertThat(tmp.resolve("lz4.nsm")).doesNotExist();
    }

    @Test
    void create_withoutTokens_isPaymentRequired() {
        FakeMarketplaceResource.balance.set(0);
        try {
            given().when().post("/api/v1/tokens/validate").then().statusCode(200);

            given()
                    .contentType(ContentType.JSON)
                    .body(Map.of("output", tmp.resolve("denied.nsm").toString(),
                            "inputs", List.of(source.toString())))
                    .when().post("/api/v1/archives")
                    .then()
                    .statusCode(402)
                    .body("error", is("NO_TOKENS_AVAILABLE"));

            assertThat(tmp.resolve("denied.nsm")).doesNotExist();
        } finally {
            FakeMarketplaceResource.balance.set(500);
            given().when().post("/api/v1/tokens/validate").then().statusCode(200);
        }
    }

    private Path create(String name, Map<String, Object> extra) {
        Path output = tmp.resolve(name);
        Map<String, Object> body = new java.util.HashMap<>(extra);
        body.put("output", output.toString());
        body.put("inputs", List.of(source.toString()));
        given()
                .contentType(ContentType.JSON)
                .body(body)
                .when().post("/api/v1/archives")
                .then()
                .statusCode(201);
        return output;
    }

    private static int availableTokens() {
        return given().when().get("/api/v1/tokens").then().statusCode(200)
                .extract().path("availableTokens");
    }
}
