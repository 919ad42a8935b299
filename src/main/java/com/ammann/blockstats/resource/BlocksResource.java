/* (C)2026 */
package com.ammann.blockstats.resource;

import com.ammann.blockstats.dto.ApiResponseDTO;
import com.ammann.blockstats.dto.BlockDTO;
import com.ammann.blockstats.dto.BlockDetailsDTO;
import com.ammann.blockstats.dto.BlockPageDTO;
import com.ammann.blockstats.exception.BlockNotFoundException;
import com.ammann.blockstats.exception.ValidationException;
import com.ammann.blockstats.properties.ApiProperties;
import com.ammann.blockstats.repository.BlockRepository;
import com.ammann.blockstats.service.ResponseCache;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

@Path(ApiProperties.BASE_URL)
@Tag(name = "Blocks", description = "Committed block lookups")
@Produces(MediaType.APPLICATION_JSON)
public class BlocksResource {

    private static final Logger LOG = Logger.getLogger(BlocksResource.class);

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 100;

    @Inject BlockRepository blockRepository;

    @Inject ResponseCache responseCache;

    @GET
    @Path(ApiProperties.Blocks.LATEST)
    @Operation(
            summary = "Get Latest Blocks",
            description =
                    "Returns a page of the most recent blocks, newest first. An invalid limit"
                            + " falls back to 10, limits above 100 are capped, an invalid offset"
                            + " falls back to 0.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Blocks retrieved successfully",
                content = @Content(schema = @Schema(implementation = BlockPageDTO.class))),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public ApiResponseDTO<BlockPageDTO> getLatestBlocks(
            @Parameter(description = "Page size (1-100, default 10)") @QueryParam("limit")
                    String limitParam,
            @Parameter(description = "Number of newest blocks to skip (default 0)")
                    @QueryParam("offset")
                    String offsetParam) {

        int limit = parseLimit(limitParam);
        int offset = parseOffset(offsetParam);
        LOG.debugf("Latest blocks request: limit=%d, offset=%d", limit, offset);

        String key =
                ResponseCache.key(
                        "GET",
                        ApiProperties.BASE_URL
                                + ApiProperties.Blocks.LATEST
                                + "?limit="
                                + limit
                                + "&offset="
                                + offset,
                        null);
        return responseCache.serve(
                key,
                () -> {
                    List<BlockDTO> blocks =
                            blockRepository.findLatest(limit, offset).stream()
                                    .map(BlockDTO::from)
                                    .toList();
                    long total = blockRepository.countBlocks();
                    return ApiResponseDTO.success(new BlockPageDTO(blocks, total, limit, offset));
                });
    }

    @GET
    @Path(ApiProperties.Blocks.BY_NUMBER)
    @Operation(summary = "Get Block", description = "Returns a single block by its number.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Block found",
                content = @Content(schema = @Schema(implementation = BlockDetailsDTO.class))),
        @APIResponse(responseCode = "400", description = "Block number is not a non-negative integer"),
        @APIResponse(responseCode = "404", description = "Block not found"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public ApiResponseDTO<BlockDetailsDTO> getBlock(
            @Parameter(description = "Block number") @PathParam("number") String numberParam) {

        long number = parseBlockNumber(numberParam);
        String key =
                ResponseCache.key(
                        "GET", ApiProperties.BASE_URL + ApiProperties.Blocks.BASE + "/" + number, null);
        return responseCache.serve(
                key,
                () ->
                        blockRepository
                                .findByNumber(number)
                                .map(block -> ApiResponseDTO.success(new BlockDetailsDTO(BlockDTO.from(block))))
                                .orElseThrow(() -> new BlockNotFoundException(number)));
    }

    static int parseLimit(String value) {
        Integer parsed = parseInt(value);
        if (parsed == null || parsed < 1) {
            return DEFAULT_LIMIT;
        }
        return Math.min(parsed, MAX_LIMIT);
    }

    static int parseOffset(String value) {
        Integer parsed = parseInt(value);
        return parsed == null || parsed < 0 ? 0 : parsed;
    }

    static long parseBlockNumber(String value) {
        try {
            long number = Long.parseLong(value == null ? "" : value.trim());
            if (number >= 0) {
                return number;
            }
        } catch (NumberFormatException e) {
            LOG.debugf("Rejected block number '%s'", value);
        }
        throw ValidationException.invalidParameter("number", value, "a non-negative integer");
    }

    private static Integer parseInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
