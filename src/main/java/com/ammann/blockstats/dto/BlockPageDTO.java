/* (C)2026 */
package com.ammann.blockstats.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One page of the latest blocks, newest first.
 *
 * @param blocks blocks on this page
 * @param total total number of stored blocks
 * @param limit effective page size after clamping
 * @param offset effective offset after clamping
 */
@Schema(description = "Paginated list of the latest blocks")
public record BlockPageDTO(
        @Schema(description = "Blocks ordered by number, newest first") List<BlockDTO> blocks,
        @Schema(description = "Total number of stored blocks") long total,
        @Schema(description = "Effective page size") int limit,
        @Schema(description = "Effective offset") int offset) {}
