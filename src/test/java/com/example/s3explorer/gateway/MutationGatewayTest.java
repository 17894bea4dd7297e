package com.example.s3explorer.gateway;

import com.example.s3explorer.gateway.MutationResult.Outcome;
import com.example.s3explorer.policy.AccessPolicy;
import com.example.s3explorer.policy.Principal;
import com.example.s3explorer.policy.Role;
import com.example.s3explorer.storage.InMemoryObjectStorage;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MutationGatewayTest {
    static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R'};
    static final byte[] PDF = "%PDF-1.4\n1 0 obj\n<<>>\nendobj\n".getBytes(StandardCharsets.US_ASCII);

    private final InMemoryObjectStorage storage = new InMemoryObjectStorage();
    private final Principal editor = new Principal("ed", Role.EDITOR, "projects/alpha");
    private final Principal viewer = new Principal("vi", Role.VIEWER, null);
    private final Principal admin = Principal.unrestricted("ad", Role.ADMIN);

    private MutationGateway gateway(long maxUploadBytes) {
        return new MutationGateway(storage, new AccessPolicy("shared/"), new ContentTypeDetector(new Tika()),
                List.of("image/png", "application/pdf"), maxUploadBytes);
    }

    @Test
    void deniedUploadNeverReachesStorage() {
        MutationResult result = gateway(1024).upload(editor, "projects/alpha/x.png", PNG);

        assertEquals(Outcome.DENIED, result.getOutcome());
        assertEquals("Access denied to this path", result.getMessage());
        assertEquals(0, storage.totalCalls());
    }

    @Test
    void roleWithoutWritePermissionIsDenied() {
        MutationResult result = gateway(1024).upload(viewer, "shared/x.png", PNG);

        assertEquals(Outcome.DENIED, result.getOutcome());
        assertEquals(0, storage.totalCalls());
    }

    @Test
    void uploadsAllowedTypesIntoSharedArea() {
        MutationGateway gateway = gateway(1024);

        MutationResult png = gateway.upload(editor, null, "chart.png", PNG);
        MutationResult pdf = gateway.upload(editor, "shared/reports", "r.pdf", PDF);

        assertTrue(png.isSuccess());
        assertEquals("shared/chart.png", png.getKey());
        assertEquals("image/png", storage.contentType("shared/chart.png"));
        assertTrue(pdf.isSuccess());
        assertEquals("shared/reports/r.pdf", pdf.getKey());
    }

    @Test
    void rejectsDisallowedContentType() {
        MutationResult result = gateway(1024).upload(editor, "shared/", "notes.txt",
                "just some text".getBytes(StandardCharsets.UTF_8));

        assertEquals(Outcome.UNSUPPORTED_MEDIA_TYPE, result.getOutcome());
        assertEquals(0, storage.putCalls.get());
    }

    @Test
    void rejectsOversizedUpload() {
        MutationResult result = gateway(4).upload(editor, "shared/", "chart.png", PNG);

        assertEquals(Outcome.TOO_LARGE, result.getOutcome());
        assertEquals(0, storage.putCalls.get());
    }

    @Test
    void rejectsTraversalInFileName() {
        assertEquals(Outcome.INVALID, gateway(1024).upload(editor, "shared/", "..", PNG).getOutcome());
        assertEquals(Outcome.INVALID, gateway(1024).upload(editor, "shared/../etc/x.png", PNG).getOutcome());
    }

    @Test
    void storageFailureIsReportedAsUploadFailed() {
        storage.failWrites();
        MutationResult result = gateway(1024).upload(editor, "shared/", "chart.png", PNG);

        assertEquals(Outcome.UPLOAD_FAILED, result.getOutcome());
        assertFalse(result.isChanged());
    }

    @Test
    void createFolderIsIdempotent() {
        MutationGateway gateway = gateway(1024);

        MutationResult first = gateway.createFolder(editor, "shared/new");
        MutationResult second = gateway.createFolder(editor, "shared/new/");

        assertTrue(first.isSuccess());
        assertTrue(first.isChanged());
        assertTrue(second.isSuccess());
        assertFalse(second.isChanged());
        assertEquals(1, storage.putCalls.get());
        assertTrue(storage.contains("shared/new/"));
    }

    @Test
    void sharedFolderLandsBelowSharedPrefix() {
        MutationResult result = gateway(1024).createSharedFolder(editor, "batch-7");
        assertEquals("shared/batch-7/", result.getKey());
        assertTrue(storage.contains("shared/batch-7/"));
    }

    @Test
    void createFolderOutsideSharedAreaIsDeniedForEditorButNotAdmin() {
        MutationGateway gateway = gateway(1024);

        assertEquals(Outcome.DENIED, gateway.createFolder(editor, "projects/alpha/new").getOutcome());
        assertEquals(0, storage.totalCalls());
        assertTrue(gateway.createFolder(admin, "projects/alpha/new").isSuccess());
    }

    @Test
    void deleteReportsMissingKey() {
        storage.with("shared/old.pdf");
        MutationGateway gateway = gateway(1024);

        assertEquals(Outcome.NOT_FOUND, gateway.delete(editor, "shared/gone.pdf").getOutcome());
        assertTrue(gateway.delete(editor, "shared/old.pdf").isSuccess());
        assertFalse(storage.contains("shared/old.pdf"));
        assertEquals(Outcome.DENIED, gateway.delete(viewer, "shared/x").getOutcome());
    }
}
