/* (C)2026 */
package com.ammann.blockstats.dto;

import com.ammann.blockstats.model.Block;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Wire representation of a committed block, shared by the REST API and the WebSocket hub.
 */
@Schema(description = "Committed block")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockDTO(
        @Schema(description = "Block number") Long number,
        @Schema(description = "Block hash") String hash,
        @Schema(description = "Parent block hash") String parentHash,
        @Schema(description = "Block timestamp in seconds since Unix epoch") Long timestamp,
        @Schema(description = "Number of transactions in the block") Long transactionCount,
        @Schema(description = "Gas used by the block") Long gasUsed,
        @Schema(description = "Gas limit of the block") Long gasLimit,
        @Schema(description = "Base fee per gas, if the chain has one") Long baseFeePerGas,
        @Schema(description = "Block producer address") String miner,
        @Schema(description = "Block size in bytes") Long size) {

    public static BlockDTO from(Block block) {
        return new BlockDTO(
                block.number,
                block.hash,
                block.parentHash,
                block.timestamp,
                block.transactionCount,
                block.gasUsed,
                block.gasLimit,
                block.baseFeePerGas,
                block.miner,
                block.size);
    }
}
