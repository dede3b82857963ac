/* (C)2026 */
package com.ammann.anomaly.resource;

import com.ammann.anomaly.dto.DetectorDefaultsDTO;
import com.ammann.anomaly.model.DetectorConfig;
import com.ammann.anomaly.properties.ApiProperties;
import com.ammann.anomaly.service.StreamRegistryService;
import com.ammann.anomaly.service.SyntheticFeedService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "System", description = "Effective service configuration")
@Produces(MediaType.APPLICATION_JSON)
public class SystemResource {

    @Inject StreamRegistryService registry;

    @Inject SyntheticFeedService feed;

    @GET
    @Path(ApiProperties.System.CONFIG)
    @Operation(
            summary = "Get Detector Defaults",
            description = "Returns the default detector configuration and synthetic feed settings.")
    public DetectorDefaultsDTO getSystemConfiguration() {
        DetectorConfig defaults = registry.defaultConfig();
        return new DetectorDefaultsDTO(
                defaults.windowSize(), defaults.threshold(), feed.isEnabled(), feed.getStreamId());
    }
}
