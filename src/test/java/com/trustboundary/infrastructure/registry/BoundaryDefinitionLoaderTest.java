package com.trustboundary.infrastructure.registry;

import com.trustboundary.domain.model.Boundary;
import com.trustboundary.domain.model.BoundaryKind;
import com.trustboundary.domain.model.BoundaryStatus;
import com.trustboundary.domain.model.Classification;
import com.trustboundary.domain.model.ControlKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundaryDefinitionLoaderTest {

    private static final String PAYMENTS = """
        {
          "boundary_id": "payments",
          "name": "Payments",
          "description": "Card processing perimeter",
          "boundary_type": "data",
          "classification": "Restricted",
          "status": "active",
          "version": "2.1.0",
          "created_at": "2024-01-01T00:00:00Z",
          "updated_at": "2024-02-01T00:00:00Z",
          "controls": [
            {"control_id": "c-auth", "control_type": "authentication"},
            {"control_id": "c-rl", "control_type": "rate_limiting", "parameters": {"max_requests": 10}}
          ],
          "attestations": [{"attestation_id": "att_1"}],
          "owner": "team-payments"
        }
        """;

    private final BoundaryDefinitionLoader loader = new BoundaryDefinitionLoader();

    @Test
    void readsSnakeCaseDefinition() {
        Boundary boundary = loader.readOne(PAYMENTS);

        assertEquals("payments", boundary.getBoundaryId());
        assertEquals(BoundaryKind.DATA, boundary.getBoundaryType());
        assertEquals(Classification.RESTRICTED, boundary.getClassification());
        assertEquals(BoundaryStatus.ACTIVE, boundary.getStatus());
        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), boundary.getUpdatedAt());
        assertEquals(List.of(ControlKind.AUTHENTICATION, ControlKind.RATE_LIMITING),
            boundary.getControls().stream().map(c -> c.getControlType()).toList());
        assertEquals(10, boundary.getControls().get(1).intParam("max_requests", -1));
        assertEquals("att_1", boundary.getAttestations().get(0).getAttestationId());
        assertTrue(boundary.getSeals().isEmpty());
    }

    @Test
    void registryLayoutKeepsKindsAndFullDocument() {
        Boundary boundary = loader.readOne("{\"boundary_id\":\"b1\",\"boundary_type\":\"process\","
            + "\"owner\":{\"id\":\"system\",\"role\":\"administrator\"},"
            + "\"controls\":[{\"control_id\":\"c1\",\"control_type\":\"authentication\","
            + "\"implementation\":{\"mechanism\":\"JWT\"}}]}");

        assertEquals(BoundaryKind.PROCESS, boundary.getBoundaryType());
        assertEquals(ControlKind.AUTHENTICATION, boundary.getControls().get(0).getControlType());
        assertEquals(Map.of("id", "system", "role", "administrator"), boundary.getDefinition().get("owner"));
    }

    @Test
    void signedContentIsSortedCompactDefinitionWithoutSignature() {
        Boundary boundary = loader.readOne("{\n  \"version\": \"1.0.0\",\n  \"signature\": \"sig\",\n"
            + "  \"owner\": {\"role\": \"admin\", \"id\": \"system\"},\n  \"boundary_id\": \"b1\"\n}");

        assertEquals("{\"boundary_id\":\"b1\",\"owner\":{\"id\":\"system\",\"role\":\"admin\"},\"version\":\"1.0.0\"}",
            loader.signedContent(boundary));
        assertEquals("sig", boundary.getSignature());
    }

    @Test
    void codeBuiltBoundaryIsRenderedInRegistryLayout() {
        Boundary boundary = Boundary.builder()
            .boundaryId("b1")
            .boundaryType(BoundaryKind.DATA)
            .version("1.0.0")
            .signature("ignored")
            .build();

        String content = loader.signedContent(boundary);

        assertTrue(content.contains("\"boundary_id\":\"b1\",\"boundary_type\":\"DATA\""), content);
        assertFalse(content.contains("signature"), content);
        assertEquals(content, loader.signedContent(boundary.toBuilder().signature("other").build()));
    }

    @Test
    void nonObjectDefinitionIsRejected() {
        assertThrows(UncheckedIOException.class, () -> loader.readOne("[1, 2]"));
    }

    @Test
    void unknownEnumValuesBecomeNull() {
        Boundary boundary = loader.readOne("{\"boundary_id\":\"b1\",\"boundary_type\":\"quantum\","
            + "\"classification\":\"ultra\",\"status\":\"active\"}");

        assertNull(boundary.getBoundaryType());
        assertNull(boundary.getClassification());
        assertEquals(BoundaryStatus.ACTIVE, boundary.getStatus());
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(UncheckedIOException.class, () -> loader.readOne("{\"boundary_id\":"));
    }

    @Test
    void loadsFileIntoRegistry(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("boundaries.json");
        Files.writeString(file, "[" + PAYMENTS + ", {\"boundary_id\": \"ledger\", \"name\": \"Ledger\"}]",
            StandardCharsets.UTF_8);
        InMemoryBoundaryRegistry registry = new InMemoryBoundaryRegistry();

        assertEquals(2, loader.loadInto(registry, file));
        assertEquals(List.of("ledger", "payments"), List.copyOf(registry.boundaryIds()));
        assertTrue(registry.get("payments").isPresent());
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class,
            () -> loader.loadInto(new InMemoryBoundaryRegistry(), dir.resolve("absent.json")));
    }
}
