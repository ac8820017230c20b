package com.bankrecon.bankrecon.pac;

/**
 * One row of the PAC export: an agreement between a bank's business customer and a user with a role.
 */
public record PacRecord(String bankId, String orgNumber, String personNumber, String agreementId, String userType) {

    /**
     * Trims every field and left-pads the organization number with zeros to {@code orgNumberWidth}.
     */
    public static PacRecord normalized(String bankId, String orgNumber, String personNumber,
                                       String agreementId, String userType, int orgNumberWidth) {
        return new PacRecord(
                trim(bankId),
                zeroPad(trim(orgNumber), orgNumberWidth),
                trim(personNumber),
                trim(agreementId),
                trim(userType)
        );
    }

    static String zeroPad(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return "0".repeat(width - value.length()) + value;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
