package com.chainbills.ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A single entity id, e.g. the payment at a given position of a list. */
@Getter
@AllArgsConstructor
public class IdResponse {
    private String id;
}
