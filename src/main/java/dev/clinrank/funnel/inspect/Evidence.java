package dev.clinrank.funnel.inspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * A chunk token that contributed to the interaction score.
 *
 * @param token the chunk token
 * @param weight its contribution to the interaction score
 * @param position token index within the chunk
 */
@JsonPropertyOrder({"token", "weight", "position"})
public record Evidence(
    @NotBlank @JsonProperty("token") String token,
    @JsonProperty(value = "weight", required = true) double weight,
    @PositiveOrZero @JsonProperty(value = "position", required = true) int position) {}
