package com.callexchange.fraud.api;

import com.callexchange.fraud.domain.Account;
import com.callexchange.fraud.domain.Bid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * REST API request body for a bid check: the bid plus the buyer account placing it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BidCheckRequest {

    @NotNull(message = "bid is required")
    private Bid bid;

    /** Buyer placing the bid. Required. */
    @NotNull(message = "account is required")
    private Account account;
}
