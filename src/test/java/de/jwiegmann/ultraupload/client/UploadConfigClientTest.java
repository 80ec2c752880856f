package de.jwiegmann.ultraupload.client;

import de.jwiegmann.ultraupload.boundary.dto.GlobalConfigResponse;
import de.jwiegmann.ultraupload.boundary.dto.UploadLimitsResponse;
import de.jwiegmann.ultraupload.control.validation.FilePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class UploadConfigClientTest {

    private MockRestServiceServer server;
    private UploadConfigClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://localhost:8080");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new UploadConfigClient(builder.build());
    }

    @Test
    void upload_limits_are_read_in_snake_case() {
        server.expect(requestTo("http://localhost:8080/api/system/upload-limits"))
                .andRespond(withSuccess("""
                        {"max_total_size":104857600,"max_file_size":20971520,"max_files":20,
                         "max_total_size_formatted":"100 MB","max_file_size_formatted":"20 MB"}
                        """, MediaType.APPLICATION_JSON));

        UploadLimitsResponse limits = client.fetchUploadLimits();

        assertThat(limits.getMaxTotalSize()).isEqualTo(104857600L);
        assertThat(limits.getMaxFiles()).isEqualTo(20);
        assertThat(limits.getMaxFileSizeFormatted()).isEqualTo("20 MB");
        server.verify();
    }

    @Test
    void failing_limits_endpoint_yields_defaults() {
        server.expect(requestTo("http://localhost:8080/api/system/upload-limits"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        UploadLimitsResponse limits = client.fetchUploadLimits();

        assertThat(limits.getMaxTotalSize()).isEqualTo(52_428_800L);
        assertThat(limits.getMaxFileSize()).isEqualTo(10_485_760L);
        assertThat(limits.getMaxFiles()).isEqualTo(20);
    }

    @Test
    void global_config_feeds_file_policy_and_upload_types() {
        server.expect(requestTo("http://localhost:8080/config/global-config"))
                .andRespond(withSuccess("""
                        {"currentLang":"de","availableLangs":["de","en"],
                         "translations":{"invalid_file_extension":"Endung :extension verboten"},
                         "envMode":"testing","allowedExtensions":["pdf"],"allowedMimeTypes":["application/pdf"],
                         "maxSize":1024,"uploadTypePaths":{"egi":"/uploading/egi"},"defaultUploadType":"egi"}
                        """, MediaType.APPLICATION_JSON));

        GlobalConfigResponse config = client.fetchGlobalConfig();
        FilePolicy policy = UploadConfigClient.filePolicyOf(config);

        assertThat(policy.getAllowedExtensions()).containsExactly("pdf");
        assertThat(policy.getMaxSize()).isEqualTo(1024);
        assertThat(policy.messageTemplate(FilePolicy.MSG_EXTENSION)).isEqualTo("Endung :extension verboten");
        assertThat(UploadConfigClient.uploadTypesOf(config).resolve("other").getPath()).isEqualTo("/uploading/egi");
        assertThat(config.getAvailableLangs()).isEqualTo(List.of("de", "en"));
        assertThat(config.getUploadTypePaths()).isEqualTo(Map.of("egi", "/uploading/egi"));
    }
}
