package com.example.s3explorer.storage;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URL;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class S3ObjectStorageTest {
    private static final StaticCredentialsProvider CREDENTIALS =
            StaticCredentialsProvider.create(AwsBasicCredentials.create("AKIDEXAMPLE", "secret"));

    @Test
    void presignsWithoutNetwork() throws Exception {
        S3Client client = S3Client.builder().region(Region.US_EAST_1).credentialsProvider(CREDENTIALS).build();
        S3Presigner presigner = S3Presigner.builder().region(Region.US_EAST_1).credentialsProvider(CREDENTIALS).build();

        try (S3ObjectStorage storage = new S3ObjectStorage(client, presigner, "circuits")) {
            URL url = storage.presignGet("dawarc/circuit/ampere/a.pdf", Duration.ofMinutes(10));

            assertEquals("https", url.getProtocol());
            assertTrue(url.getPath().endsWith("/dawarc/circuit/ampere/a.pdf"));
            assertTrue(url.getQuery().contains("X-Amz-Expires=600"));
            assertTrue(url.getQuery().contains("X-Amz-Signature="));
        }
    }

    @Test
    void requiresBucket() {
        assertThrows(IllegalArgumentException.class, () -> new S3ObjectStorage(null, null, " "));
    }
}
