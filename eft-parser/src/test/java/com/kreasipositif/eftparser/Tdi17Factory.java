package com.kreasipositif.eftparser;

/**
 * Builds fixed-width TDI17 lines for tests. Every line is right padded to
 * {@link EFTConstants#EXPECTED_LINE_LENGTH}.
 */
public final class Tdi17Factory {

    private Tdi17Factory() {
    }

    public static String header(String recordType,
                                String creationDate, String creationTime,
                                String depositStartDate, String depositEndDate) {
        String line = recordType
                + "CREATION DATE: " + creationDate
                + "CREATION TIME:   " + creationTime
                + "DEPOSIT DATE(S) FROM:   " + depositStartDate
                + " TO DATE :  " + depositEndDate;
        return padLine(line);
    }

    public static String trailer(String recordType, String numberOfDetails, String totalDepositAmount) {
        return padLine(recordType
                + leftPadZero(numberOfDetails, 6)
                + leftPadZero(money(totalDepositAmount), 14));
    }

    public static RecordBuilder record() {
        return new RecordBuilder();
    }

    /** Money fields end with a blank when positive and with a minus sign when negative. */
    public static String money(String value) {
        String trimmed = value.strip();
        return trimmed.endsWith("-") ? trimmed : trimmed + " ";
    }

    public static String leftPadZero(String value, int width) {
        return "0".repeat(Math.max(0, width - value.length())) + value;
    }

    public static String rightPadSpace(String value, int width) {
        return value + " ".repeat(Math.max(0, width - value.length()));
    }

    public static String padLine(String value) {
        return rightPadSpace(value, EFTConstants.EXPECTED_LINE_LENGTH);
    }

    /**
     * Transaction line builder, pre-filled with a valid ministry AT / program 0146 deposit.
     */
    public static final class RecordBuilder {
        private String recordType = EFTConstants.TRANSACTION_RECORD_TYPE;
        private String ministryCode = "AT";
        private String programCode = "0146";
        private String depositDate = "20230810";
        private String depositTime = "0000";
        private String locationId = "85004";
        private String transactionSequence = "001";
        private String transactionDescription = "DEPOSIT          26";
        private String depositAmount = "13500";
        private String currency = "";
        private String exchangeAdjAmount = "0";
        private String depositAmountCad = "13500";
        private String destinationBankNumber = "0003";
        private String batchNumber = "002400986";
        private String jvType = "I";
        private String jvNumber = "002425669";
        private String transactionDate = "";

        public RecordBuilder recordType(String v) { this.recordType = v; return this; }
        public RecordBuilder ministryCode(String v) { this.ministryCode = v; return this; }
        public RecordBuilder programCode(String v) { this.programCode = v; return this; }
        public RecordBuilder depositDate(String v) { this.depositDate = v; return this; }
        public RecordBuilder depositTime(String v) { this.depositTime = v; return this; }
        public RecordBuilder locationId(String v) { this.locationId = v; return this; }
        public RecordBuilder transactionSequence(String v) { this.transactionSequence = v; return this; }
        public RecordBuilder transactionDescription(String v) { this.transactionDescription = v; return this; }
        public RecordBuilder depositAmount(String v) { this.depositAmount = v; return this; }
        public RecordBuilder currency(String v) { this.currency = v; return this; }
        public RecordBuilder exchangeAdjAmount(String v) { this.exchangeAdjAmount = v; return this; }
        public RecordBuilder depositAmountCad(String v) { this.depositAmountCad = v; return this; }
        public RecordBuilder destinationBankNumber(String v) { this.destinationBankNumber = v; return this; }
        public RecordBuilder batchNumber(String v) { this.batchNumber = v; return this; }
        public RecordBuilder jvType(String v) { this.jvType = v; return this; }
        public RecordBuilder jvNumber(String v) { this.jvNumber = v; return this; }
        public RecordBuilder transactionDate(String v) { this.transactionDate = v; return this; }

        public String build() {
            String line = recordType + ministryCode + programCode + depositDate + locationId
                    + rightPadSpace(depositTime, 4)
                    + transactionSequence
                    + rightPadSpace(transactionDescription, 40)
                    + leftPadZero(money(depositAmount), 13)
                    + rightPadSpace(currency, 2)
                    + leftPadZero(money(exchangeAdjAmount), 13)
                    + leftPadZero(money(depositAmountCad), 13)
                    + destinationBankNumber + batchNumber + jvType + jvNumber + transactionDate;
            return padLine(line);
        }
    }
}
