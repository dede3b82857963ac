/* (C)2026 */
package com.ammann.anomaly.resource;

import com.ammann.anomaly.dto.AnomalyLogResponseDTO;
import com.ammann.anomaly.dto.CreateStreamRequestDTO;
import com.ammann.anomaly.dto.IngestResponseDTO;
import com.ammann.anomaly.dto.IngestResponseDTO.RejectedSampleDTO;
import com.ammann.anomaly.dto.StreamStatusDTO;
import com.ammann.anomaly.dto.TickResultDTO;
import com.ammann.anomaly.dto.WindowStatisticDTO;
import com.ammann.anomaly.exception.ValidationException;
import com.ammann.anomaly.model.DetectorConfig;
import com.ammann.anomaly.properties.ApiProperties;
import com.ammann.anomaly.service.StreamRegistryService;
import com.ammann.anomaly.service.StreamRegistryService.BatchResult;
import com.ammann.anomaly.service.StreamRegistryService.StreamSnapshot;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for registering sample streams, pushing samples into them and
 * reading back statistics and anomaly logs.
 *
 * <p>Unknown streams answer 404; invalid detector parameters and rejected samples
 * answer 400 through the global exception mapper.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Streams API", description = "Sliding-window anomaly detection over sample streams")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class StreamResource {

    private static final Logger LOG = Logger.getLogger(StreamResource.class);
    private static final int MAX_BATCH_SIZE = 10_000;

    @Inject StreamRegistryService registry;

    @POST
    @Path(ApiProperties.Streams.BASE)
    @Operation(
            summary = "Register Stream",
            description = "Creates a stream detector. Omitted parameters use the configured defaults.")
    @APIResponses({
        @APIResponse(
                responseCode = "201",
                description = "Stream created",
                content = @Content(schema = @Schema(implementation = StreamStatusDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid configuration or duplicate id")
    })
    public Response createStream(CreateStreamRequestDTO request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }

        DetectorConfig defaults = registry.defaultConfig();
        DetectorConfig config =
                new DetectorConfig(
                        request.windowSize() != null ? request.windowSize() : defaults.windowSize(),
                        request.threshold() != null ? request.threshold() : defaults.threshold());

        registry.create(request.id(), config);
        return Response.status(Response.Status.CREATED)
                .entity(toStatus(registry.snapshot(request.id())))
                .build();
    }

    @GET
    @Path(ApiProperties.Streams.BASE)
    @Operation(summary = "List Streams", description = "Returns the ids of all registered streams.")
    public List<String> listStreams() {
        return registry.streamIds();
    }

    @GET
    @Path(ApiProperties.Streams.BY_ID)
    @Operation(
            summary = "Get Stream Status",
            description = "Returns configuration, samples seen, current statistic and anomaly count.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Stream status",
                content = @Content(schema = @Schema(implementation = StreamStatusDTO.class))),
        @APIResponse(responseCode = "404", description = "Unknown stream")
    })
    public StreamStatusDTO getStream(
            @Parameter(description = "Stream identifier") @PathParam(ApiProperties.STREAM_ID)
                    String streamId) {
        return toStatus(registry.snapshot(streamId));
    }

    @POST
    @Path(ApiProperties.Streams.SAMPLES)
    @Operation(
            summary = "Ingest Samples",
            description =
                    "Pushes samples through the stream in order and returns one result per accepted"
                            + " sample. Missing or non-finite samples are rejected individually.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Batch processed",
                content = @Content(schema = @Schema(implementation = IngestResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Empty or oversized batch"),
        @APIResponse(responseCode = "404", description = "Unknown stream")
    })
    public IngestResponseDTO ingestSamples(
            @Parameter(description = "Stream identifier") @PathParam(ApiProperties.STREAM_ID)
                    String streamId,
            List<Double> samples) {

        if (samples == null || samples.isEmpty()) {
            throw ValidationException.invalidParameter("samples", samples, "non-empty array");
        }
        if (samples.size() > MAX_BATCH_SIZE) {
            throw ValidationException.invalidParameter(
                    "samples", samples.size() + " items", "at most " + MAX_BATCH_SIZE + " items");
        }

        BatchResult batch = registry.ingestAll(streamId, samples);

        List<TickResultDTO> ticks = batch.results().stream().map(TickResultDTO::from).toList();
        List<RejectedSampleDTO> rejections =
                batch.rejections().stream()
                        .map(r -> new RejectedSampleDTO(r.index(), r.reason()))
                        .toList();

        LOG.debugf(
                "Ingested %d samples into '%s' (%d rejected)",
                Integer.valueOf(ticks.size()), streamId, Integer.valueOf(rejections.size()));
        return new IngestResponseDTO(
                streamId, ticks.size(), rejections.size(), batch.anomalyCount(), ticks, rejections);
    }

    @GET
    @Path(ApiProperties.Streams.ANOMALIES)
    @Operation(summary = "Get Anomaly Log", description = "Returns all anomalies in discovery order.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Anomaly log",
                content = @Content(schema = @Schema(implementation = AnomalyLogResponseDTO.class))),
        @APIResponse(responseCode = "404", description = "Unknown stream")
    })
    public AnomalyLogResponseDTO getAnomalies(
            @Parameter(description = "Stream identifier") @PathParam(ApiProperties.STREAM_ID)
                    String streamId) {
        return AnomalyLogResponseDTO.of(streamId, registry.anomalies(streamId));
    }

    @POST
    @Path(ApiProperties.Streams.RESET)
    @Operation(
            summary = "Reset Stream",
            description = "Discards window and anomaly log, keeping the stream's configuration.")
    public StreamStatusDTO resetStream(
            @Parameter(description = "Stream identifier") @PathParam(ApiProperties.STREAM_ID)
                    String streamId) {
        registry.reset(streamId);
        return toStatus(registry.snapshot(streamId));
    }

    @DELETE
    @Path(ApiProperties.Streams.BY_ID)
    @Operation(summary = "Delete Stream")
    public Response deleteStream(
            @Parameter(description = "Stream identifier") @PathParam(ApiProperties.STREAM_ID)
                    String streamId) {
        if (!registry.delete(streamId)) {
            throw new NotFoundException("Stream '" + streamId + "' not found");
        }
        return Response.noContent().build();
    }

    private StreamStatusDTO toStatus(StreamSnapshot snapshot) {
        return new StreamStatusDTO(
                snapshot.streamId(),
                snapshot.config().windowSize(),
                snapshot.config().threshold(),
                snapshot.samplesSeen(),
                snapshot.warmingUp(),
                WindowStatisticDTO.from(snapshot.statistic()),
                snapshot.anomalyCount());
    }
}
