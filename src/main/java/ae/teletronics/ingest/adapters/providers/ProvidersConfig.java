package ae.teletronics.ingest.adapters.providers;

import ae.teletronics.ingest.adapters.providers.cloudinary.CloudinaryStorageProvider;
import ae.teletronics.ingest.adapters.providers.s3.S3StorageProvider;
import ae.teletronics.ingest.ports.ClockProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.time.Duration;

/**
 * Remote storage backends. An endpoint override plus path-style access points the S3 client at
 * MinIO or another S3-compatible store. Tests bring their own providers.
 */
@Configuration
@Profile("!test")
public class ProvidersConfig {

    @Bean
    @ConditionalOnMissingBean(AwsCredentialsProvider.class)
    public AwsCredentialsProvider awsCredentialsProvider(
            @Value("${ingest.providers.s3.access-key:}") String accessKey,
            @Value("${ingest.providers.s3.secret-key:}") String secretKey
    ) {
        if (StringUtils.hasText(accessKey) && StringUtils.hasText(secretKey)) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        return DefaultCredentialsProvider.create();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(S3Client.class)
    public S3Client s3Client(AwsCredentialsProvider credentials,
                             @Value("${ingest.providers.s3.region:us-east-1}") String region,
                             @Value("${ingest.providers.s3.endpoint:}") String endpoint,
                             @Value("${ingest.providers.s3.path-style-access:false}") boolean pathStyleAccess) {
        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(credentials)
                .region(Region.of(region))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(pathStyleAccess)
                        .build());
        if (StringUtils.hasText(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(S3Presigner.class)
    public S3Presigner s3Presigner(AwsCredentialsProvider credentials,
                                   @Value("${ingest.providers.s3.region:us-east-1}") String region,
                                   @Value("${ingest.providers.s3.endpoint:}") String endpoint,
                                   @Value("${ingest.providers.s3.path-style-access:false}") boolean pathStyleAccess) {
        S3Presigner.Builder builder = S3Presigner.builder()
                .credentialsProvider(credentials)
                .region(Region.of(region))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(pathStyleAccess)
                        .build());
        if (StringUtils.hasText(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    @Bean
    public S3StorageProvider s3StorageProvider(S3Client s3Client,
                                               S3Presigner presigner,
                                               @Value("${ingest.providers.s3.bucket:ingest-files}") String bucket,
                                               @Value("${ingest.providers.s3.region:us-east-1}") String region,
                                               @Value("${ingest.providers.s3.cdn-domain:}") String cdnDomain,
                                               @Value("${ingest.providers.s3.timeout:PT60S}") Duration timeout) {
        return new S3StorageProvider(s3Client, presigner, new S3StorageProvider.Settings(bucket, region, cdnDomain, timeout));
    }

    @Bean
    public CloudinaryStorageProvider cloudinaryStorageProvider(WebClient.Builder webClientBuilder,
                                                               ClockProvider clock,
                                                               @Value("${ingest.providers.cloudinary.cloud-name:}") String cloudName,
                                                               @Value("${ingest.providers.cloudinary.api-key:}") String apiKey,
                                                               @Value("${ingest.providers.cloudinary.api-secret:}") String apiSecret,
                                                               @Value("${ingest.providers.cloudinary.folder:ingest}") String folder,
                                                               @Value("${ingest.providers.cloudinary.api-base-url:https://api.cloudinary.com}") String apiBaseUrl,
                                                               @Value("${ingest.providers.cloudinary.timeout:PT60S}") Duration timeout) {
        return new CloudinaryStorageProvider(webClientBuilder.build(), clock,
                new CloudinaryStorageProvider.Settings(cloudName, apiKey, apiSecret, folder, apiBaseUrl, timeout));
    }
}
