package com.chainbills.ledger.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned to callers. The enum name is the wire code.
 */
@Getter
public enum LedgerError {

    // validation
    ZERO_AMOUNT_SPECIFIED(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Amount must be greater than zero"),
    INVALID_TOKEN(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Token is not supported"),
    MATCHING_TOKEN_AND_AMOUNT_NOT_FOUND(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION,
            "Token and amount do not match any allowed entry of the payable"),
    MAX_PAYABLE_TOKENS_CAPACITY_REACHED(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION,
            "Too many allowed tokens and amounts"),
    EMPTY_DESCRIPTION_PROVIDED(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Description is empty"),
    MAX_PAYABLE_DESCRIPTION_REACHED(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Description is too long"),
    INVALID_WALLET_ADDRESS(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Invalid wallet address"),
    NO_BALANCE_FOR_WITHDRAWAL_TOKEN(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION,
            "Payable holds no balance in this token"),
    INSUFFICIENT_WITHDRAW_AMOUNT(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION,
            "Requested amount exceeds the payable balance"),
    INVALID_PAYLOAD(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION, "Malformed cross-chain payload"),
    PAYABLE_IS_CLOSED(HttpStatus.CONFLICT, ErrorCategory.VALIDATION, "Payable is closed"),

    // authorization
    NOT_YOUR_PAYABLE(HttpStatus.FORBIDDEN, ErrorCategory.AUTHORIZATION, "Caller is not the host of this payable"),
    INVALID_CALLER_ADDRESS(HttpStatus.UNAUTHORIZED, ErrorCategory.AUTHORIZATION, "Invalid caller address"),
    UNAUTHORIZED_CALLER_ADDRESS(HttpStatus.FORBIDDEN, ErrorCategory.AUTHORIZATION,
            "Caller is not registered for this entity on the emitter chain"),
    INVALID_ATTESTATION(HttpStatus.UNAUTHORIZED, ErrorCategory.AUTHORIZATION, "Message attestation is invalid"),
    UNREGISTERED_EMITTER(HttpStatus.FORBIDDEN, ErrorCategory.AUTHORIZATION, "Emitter is not a registered contract"),

    // consistency
    DUPLICATE_MESSAGE(HttpStatus.CONFLICT, ErrorCategory.CONSISTENCY, "Message was already applied"),
    MESSAGE_IN_FLIGHT(HttpStatus.CONFLICT, ErrorCategory.CONSISTENCY, "Message is being processed"),
    INVALID_ACTION_ID(HttpStatus.BAD_REQUEST, ErrorCategory.CONSISTENCY, "Unexpected action id"),
    NOT_MATCHING_PAYABLE_ID(HttpStatus.CONFLICT, ErrorCategory.CONSISTENCY, "Payable id does not match the message"),
    NOT_MATCHING_TRANSACTION_TOKEN(HttpStatus.CONFLICT, ErrorCategory.CONSISTENCY, "Token does not match the message"),
    NOT_MATCHING_TRANSACTION_AMOUNT(HttpStatus.CONFLICT, ErrorCategory.CONSISTENCY, "Amount does not match the message"),
    WRONG_WITHDRAWALS_HOST_COUNT_PROVIDED(HttpStatus.CONFLICT, ErrorCategory.CONSISTENCY,
            "Host withdrawal count is not the next expected value"),

    // arithmetic
    ARITHMETIC_OVERFLOW(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCategory.ARITHMETIC, "Numeric overflow"),

    // lookups
    INVALID_PAYABLE_ID(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "Payable not found"),
    INVALID_PAYMENT_ID(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "Payment not found"),
    INVALID_WITHDRAWAL_ID(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "Withdrawal not found"),
    INVALID_USER(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "User not found"),
    INVALID_USER_PAYMENT_COUNT(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "No user payment at this count"),
    INVALID_PAYABLE_PAYMENT_COUNT(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND, "No payable payment at this count"),
    INVALID_PAYABLE_WITHDRAWAL_COUNT(HttpStatus.NOT_FOUND, ErrorCategory.NOT_FOUND,
            "No payable withdrawal at this count");

    private final HttpStatus status;
    private final ErrorCategory category;
    private final String defaultMessage;

    LedgerError(HttpStatus status, ErrorCategory category, String defaultMessage) {
        this.status = status;
        this.category = category;
        this.defaultMessage = defaultMessage;
    }
}
