package com.deva.user_directory_service.config;

import com.deva.user_directory_service.model.User;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "userdirectory")
public record UserDirectoryProperties(Auth auth, Logging logging, Pipeline pipeline, List<User> seed) {

    public UserDirectoryProperties {
        auth = auth != null ? auth : new Auth(null, null, null);
        logging = logging != null ? logging : new Logging(null, null);
        pipeline = pipeline != null ? pipeline : new Pipeline(null, null);
        seed = seed != null ? List.copyOf(seed) : List.of(
                new User("Alice", 25),
                new User("Bob", 30),
                new User("Charlie", 35));
    }

    /**
     * @param invertedTokenCheck when true the configured token is the one that gets rejected,
     *                           matching the behaviour existing clients were built against
     */
    public record Auth(String headerName, String token, Boolean invertedTokenCheck) {
        public Auth {
            headerName = headerName == null || headerName.isBlank() ? "Authorization" : headerName;
            token = token != null ? token : "Bearer my-secure-token";
            invertedTokenCheck = invertedTokenCheck != null ? invertedTokenCheck : Boolean.TRUE;
        }
    }

    public record Logging(List<String> redactedHeaders, Integer maxBodyLength) {
        public Logging {
            redactedHeaders = redactedHeaders != null ? List.copyOf(redactedHeaders) : List.of("Authorization");
            maxBodyLength = maxBodyLength != null && maxBodyLength > 0 ? maxBodyLength : 4096;
        }
    }

    /**
     * @param maxBodyBytes largest request body buffered for the pipeline; bigger requests get a 413
     */
    public record Pipeline(List<String> excludedPaths, Integer maxBodyBytes) {
        public Pipeline {
            excludedPaths = excludedPaths != null ? List.copyOf(excludedPaths) : List.of("/actuator/**");
            maxBodyBytes = maxBodyBytes != null && maxBodyBytes > 0 ? maxBodyBytes : 1024 * 1024;
        }
    }
}
