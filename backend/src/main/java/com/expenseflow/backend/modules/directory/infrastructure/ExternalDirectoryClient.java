package com.expenseflow.backend.modules.directory.infrastructure;

import java.util.List;

import com.expenseflow.backend.modules.directory.domain.ExternalEmployeeRecord;

public interface ExternalDirectoryClient {

    /**
     * Fetches the full HR roster, mapped and with repeated people merged.
     */
    List<ExternalEmployeeRecord> fetchRoster();
}
