/* (C)2026 */
package com.ammann.blockstats.resource;

import com.ammann.blockstats.dto.ApiResponseDTO;
import com.ammann.blockstats.dto.StatsDTO;
import com.ammann.blockstats.exception.StatsUnavailableException;
import com.ammann.blockstats.model.StatSnapshot;
import com.ammann.blockstats.properties.ApiProperties;
import com.ammann.blockstats.service.ResponseCache;
import com.ammann.blockstats.service.SlidingWindowAggregator;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

@Path(ApiProperties.BASE_URL)
@Tag(name = "Statistics", description = "Live throughput statistics over the block window")
@Produces(MediaType.APPLICATION_JSON)
public class StatsResource {

    private static final Logger LOG = Logger.getLogger(StatsResource.class);

    @Inject SlidingWindowAggregator aggregator;

    @Inject ResponseCache responseCache;

    @GET
    @Path(ApiProperties.Stats.BASE)
    @Operation(
            summary = "Get Throughput Statistics",
            description =
                    "Returns transactions per second, gas per second and the average interval"
                            + " between transactions over the current block window.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Statistics retrieved successfully",
                content = @Content(schema = @Schema(implementation = StatsDTO.class))),
        @APIResponse(responseCode = "404", description = "No blocks seen yet"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public ApiResponseDTO<StatsDTO> getStats() {
        String key = ResponseCache.key("GET", ApiProperties.BASE_URL + ApiProperties.Stats.BASE, null);
        return responseCache.serve(
                key,
                () -> {
                    StatSnapshot snapshot = aggregator.getSnapshot();
                    if (snapshot == null) {
                        throw new StatsUnavailableException();
                    }
                    LOG.debugf(
                            "Serving stats over %d blocks: tps=%.2f",
                            Integer.valueOf(snapshot.blockCount()),
                            Double.valueOf(snapshot.tps()));
                    return ApiResponseDTO.success(StatsDTO.from(snapshot));
                });
    }
}
