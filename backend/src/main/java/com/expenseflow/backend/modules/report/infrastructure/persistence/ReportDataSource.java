package com.expenseflow.backend.modules.report.infrastructure.persistence;

/**
 * Read-only view of a report's content rows (mileage, receipts, time entries).
 */
public interface ReportDataSource {

    ReportContentCounts countContent(String reportId);

    record ReportContentCounts(long mileageEntries, long receipts, long timeEntries) {

        public boolean isEmpty() {
            return mileageEntries + receipts + timeEntries == 0;
        }
    }
}
