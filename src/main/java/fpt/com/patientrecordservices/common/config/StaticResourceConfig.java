package fpt.com.patientrecordservices.common.config;

import fpt.com.patientrecordservices.common.constants.Constants;
import fpt.com.patientrecordservices.common.storage.StorageProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * Serves uploaded files back under the same paths that are stored in the database.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final StorageProperties storageProperties;

    public StaticResourceConfig(StorageProperties storageProperties) {
        this.storageProperties = storageProperties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        Path root = Path.of(storageProperties.getRoot()).toAbsolutePath().normalize();
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(location(root));
        registry.addResourceHandler("/" + Constants.CLINICAL_DOCS_DIR + "/**")
                .addResourceLocations(location(root.resolve(Constants.CLINICAL_DOCS_DIR)));
        registry.addResourceHandler("/" + Constants.PROFILE_PHOTOS_DIR + "/**")
                .addResourceLocations(location(root.resolve(Constants.PROFILE_PHOTOS_DIR)));
    }

    private static String location(Path dir) {
        String uri = dir.toUri().toString();
        return uri.endsWith("/") ? uri : uri + "/";
    }
}
