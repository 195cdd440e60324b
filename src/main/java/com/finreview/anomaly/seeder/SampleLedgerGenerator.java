package com.finreview.anomaly.seeder;

import com.finreview.anomaly.model.LedgerTransaction;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds a reproducible synthetic general ledger for demos and tests.
 *
 * Buckets:
 *   Revenue - Product A    15-30 invoices/month, 30% uplift in Q4
 *   Revenue - Services     steady retainers from three clients
 *   OPEX - Marketing       5-15 expenses/month, 2.5x campaign spike in {@link #MARKETING_SPIKE}
 *   OPEX - Office Rent     fixed rent plus a one-off fit-out invoice in {@link #RENT_SPIKE}
 *   Payroll - Salaries     fixed payroll with small drift
 *   OPEX - Legal           only two active months, so it is always excluded
 *
 * Expenses are negative, revenue positive.
 */
public class SampleLedgerGenerator {

    public static final YearMonth START = YearMonth.of(2023, 1);
    public static final int MONTHS = 24;
    public static final YearMonth MARKETING_SPIKE = YearMonth.of(2024, 8);
    public static final YearMonth RENT_SPIKE = YearMonth.of(2024, 3);

    private static final String[] MEDIA_VENDORS = {
            "ACME Media Ltd", "Bright Billboards", "Click Search Ads", "Delta Print House", "Echo Events"
    };
    private static final String[] SERVICE_CLIENTS = {"Northwind Retail", "Globex Corp", "Initech"};

    private final long seed;
    private int docCounter;

    public SampleLedgerGenerator() {
        this(42L);
    }

    public SampleLedgerGenerator(long seed) {
        this.seed = seed;
    }

    public List<LedgerTransaction> generate() {
        Random random = new Random(seed);
        docCounter = 100000;
        List<LedgerTransaction> rows = new ArrayList<>();

        for (int m = 0; m < MONTHS; m++) {
            YearMonth period = START.plusMonths(m);
            productRevenue(rows, random, period);
            serviceRevenue(rows, random, period);
            marketing(rows, random, period);
            officeRent(rows, period);
            payroll(rows, random, period);
        }

        // Two isolated legal invoices
        rows.add(row("OPEX - Legal", "OPEX", START.plusMonths(4), -8500.0, "Baker & Partners"));
        rows.add(row("OPEX - Legal", "OPEX", START.plusMonths(17), -12250.0, "Baker & Partners"));
        return rows;
    }

    private void productRevenue(List<LedgerTransaction> rows, Random random, YearMonth period) {
        int count = 15 + random.nextInt(16);
        boolean q4 = period.getMonthValue() >= 10;
        for (int i = 0; i < count; i++) {
            double amount = 5000 + random.nextDouble() * 45000;
            if (q4) amount *= 1.3;
            String customer = String.format("CUST-%03d", 1 + random.nextInt(20));
            rows.add(row("Revenue - Product A", "Revenue", period, amount, customer));
        }
    }

    private void serviceRevenue(List<LedgerTransaction> rows, Random random, YearMonth period) {
        for (String client : SERVICE_CLIENTS) {
            double amount = 20000 + random.nextGaussian() * 800;
            rows.add(row("Revenue - Services", "Revenue", period, amount, client));
        }
    }

    private void marketing(List<LedgerTransaction> rows, Random random, YearMonth period) {
        int count = 5 + random.nextInt(11);
        boolean spike = period.equals(MARKETING_SPIKE);
        for (int i = 0; i < count; i++) {
            double amount = -(1000 + random.nextDouble() * 19000);
            String vendor = MEDIA_VENDORS[random.nextInt(MEDIA_VENDORS.length)];
            if (spike && "ACME Media Ltd".equals(vendor)) {
                amount *= 2.5;
            }
            rows.add(row("OPEX - Marketing", "OPEX", period, amount, vendor));
        }
        if (spike) {
            rows.add(row("OPEX - Marketing", "OPEX", period, -250000.0, "ACME Media Ltd"));
        }
    }

    private void officeRent(List<LedgerTransaction> rows, YearMonth period) {
        rows.add(row("OPEX - Office Rent", "OPEX", period, -12000.0, "City Estates"));
        if (period.equals(RENT_SPIKE)) {
            rows.add(row("OPEX - Office Rent", "OPEX", period, -30000.0, "Fitout Contractors"));
        }
    }

    private void payroll(List<LedgerTransaction> rows, Random random, YearMonth period) {
        double amount = -(150000 + random.nextGaussian() * 1500);
        rows.add(row("Payroll - Salaries", "Payroll", period, amount, null));
    }

    private LedgerTransaction row(String bucket, String type, YearMonth period, double amount, String counterparty) {
        return LedgerTransaction.builder()
                .transactionId("DOC-" + docCounter++)
                .bucket(bucket)
                .entity("BG")
                .type(type)
                .period(period)
                .amount(Math.round(amount * 100.0) / 100.0)
                .counterparty(counterparty)
                .build();
    }
}
