package com.connector.cli;

import com.connector.service.api.StateService;
import com.connector.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetailsCommandTest {

    @Mock
    private StateService stateService;

    @InjectMocks
    private DetailsCommand detailsCommand;

    @Test
    void details_listsEverythingTheIntegrationOffers() {
        // --- Arrange ---
        when(stateService.getDefinition("sheets")).thenReturn(Fixtures.integration("rpcs.json"));

        // --- Act ---
        String output = detailsCommand.details("sheets", null);

        // --- Assert ---
        assertThat(output).contains("Integration: ")
                .contains("listSpreadsheets")
                .contains("listSheets")
                .contains("(needs 'spreadsheetId')");
    }

    @Test
    void details_withModule_describesItsParameters() {
        // --- Arrange ---
        when(stateService.getDefinition("crm")).thenReturn(Fixtures.integration("runtime.json"));

        // --- Act ---
        String output = detailsCommand.details("crm", "createContact");

        // --- Assert ---
        assertThat(output).contains("createContact")
                .contains("action")
                .contains("- email (type: email, required: true)")
                .contains("- source (type: text, required: false)");
    }

    @Test
    void details_whenIntegrationOrModuleIsUnknown_printsAnError() {
        // --- Arrange ---
        lenient().when(stateService.getDefinition("crm")).thenReturn(Fixtures.integration("runtime.json"));

        // --- Act & Assert ---
        assertThat(detailsCommand.details("erp", null)).contains("No integration named 'erp'");
        assertThat(detailsCommand.details("crm", "missing")).contains("Module 'missing' not found");
    }
}
