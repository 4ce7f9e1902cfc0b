package com.nosota.mshop.api.request;

/**
 * Body of deposit and withdrawal calls.
 * <p>
 * The amount is checked by the wallet service rather than by bean validation so that
 * a missing or non-positive value is reported as an invalid amount.
 * </p>
 *
 * @param amount Amount to move, in whole wallet units
 */
public record AmountRequest(Long amount) {
}
