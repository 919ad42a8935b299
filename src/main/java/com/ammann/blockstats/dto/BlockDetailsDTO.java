/* (C)2026 */
package com.ammann.blockstats.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Single block lookup result")
public record BlockDetailsDTO(@Schema(description = "The requested block") BlockDTO block) {}
