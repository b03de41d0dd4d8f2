package org.tsappend.datapipeline.staging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class S3StagingClientTest {

    @Mock
    private S3Client s3Client;

    @TempDir
    Path targetDir;

    private S3StagingClient client;

    @BeforeEach
    void setUp() {
        client = new S3StagingClient(s3Client);
    }

    private void givenObjects(String... keys) {
        List<S3Object> objects = Arrays.stream(keys).map(k -> S3Object.builder().key(k).build())
                .collect(Collectors.toList());
        when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenAnswer(inv -> new ListObjectsV2Iterable(s3Client, inv.getArgument(0)));
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(ListObjectsV2Response.builder().contents(objects).isTruncated(false).build());
    }

    @SuppressWarnings("unchecked")
    private void givenDownloadsReturnTheirKey() {
        when(s3Client.getObject(any(GetObjectRequest.class), any(ResponseTransformer.class))).thenAnswer(inv -> {
            GetObjectRequest request = inv.getArgument(0);
            ResponseTransformer<GetObjectResponse, ?> transformer = inv.getArgument(1);
            byte[] body = request.key().getBytes(StandardCharsets.UTF_8);
            return transformer.transform(GetObjectResponse.builder().build(),
                    AbortableInputStream.create(new ByteArrayInputStream(body)));
        });
    }

    @Test
    @DisplayName("a store prefix is staged below its own name")
    void stripsUpToTheLastSlash() throws IOException {
        givenObjects("stores/era5/dataset.json", "stores/era5/t2m/0.0.0");
        givenDownloadsReturnTheirKey();

        int staged = client.stage("s3://bucket/stores/era5", targetDir);

        assertThat(staged).isEqualTo(2);
        assertThat(targetDir.resolve("era5/dataset.json")).hasContent("stores/era5/dataset.json");
        assertThat(targetDir.resolve("era5/t2m/0.0.0")).exists();
    }

    @Test
    void trailingSlashStagesTheDirectoryContents() throws IOException {
        givenObjects("incoming/2024/a.json", "incoming/b.json");
        givenDownloadsReturnTheirKey();

        client.stage("s3://bucket/incoming/", targetDir);

        assertThat(targetDir.resolve("2024/a.json")).exists();
        assertThat(targetDir.resolve("b.json")).exists();
    }

    @Test
    void listsWithBucketAndPrefix() throws IOException {
        givenObjects();

        assertThat(client.stage("s3://my-bucket/some/prefix", targetDir)).isZero();

        ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3Client).listObjectsV2Paginator(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo("my-bucket");
        assertThat(captor.getValue().prefix()).isEqualTo("some/prefix");
    }

    @Test
    @SuppressWarnings("unchecked")
    void skipsDirectoryMarkers() throws IOException {
        givenObjects("incoming/", "incoming/a.json");
        givenDownloadsReturnTheirKey();

        assertThat(client.stage("s3://bucket/incoming/", targetDir)).isEqualTo(1);
        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObject(captor.capture(), any(ResponseTransformer.class));
        assertThat(captor.getValue().key()).isEqualTo("incoming/a.json");
    }

    @Test
    void sdkFailuresBecomeIOExceptions() {
        when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenThrow(SdkClientException.create("no credentials"));

        assertThatThrownBy(() -> client.stage("s3://bucket/x", targetDir))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no credentials");
    }

    @Test
    @SuppressWarnings("unchecked")
    void rejectsOtherSchemes() throws IOException {
        assertThatThrownBy(() -> client.stage("gs://bucket/x", targetDir))
                .isInstanceOf(IllegalArgumentException.class);
        verify(s3Client, never()).getObject(any(GetObjectRequest.class), any(ResponseTransformer.class));
        assertThat(targetDir).isEmptyDirectory();
    }
}
