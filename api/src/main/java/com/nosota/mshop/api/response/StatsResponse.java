package com.nosota.mshop.api.response;

/**
 * Admin dashboard figures, computed on every request.
 *
 * @param totalUsers     Number of accounts with the user role (the admin is not counted)
 * @param totalItems     Number of catalog items
 * @param totalPurchases Number of purchases ever made
 * @param totalRevenue   Sum of all purchase prices, 0 when there are none
 */
public record StatsResponse(
        long totalUsers,
        long totalItems,
        long totalPurchases,
        long totalRevenue
) {}
