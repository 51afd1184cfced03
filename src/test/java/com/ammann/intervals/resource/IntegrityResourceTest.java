/* (C)2026 */
package com.ammann.intervals.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.intervals.dto.ValidationReportDTO;
import com.ammann.intervals.exception.StorageFailureException;
import com.ammann.intervals.service.IntegrityValidationService;
import com.ammann.intervals.service.ValidationReportFormatter;
import com.ammann.intervals.support.TestSchedule;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IntegrityResourceTest {

    private TestSchedule schedule;
    private IntegrityResource resource;

    @BeforeEach
    void setUp() {
        schedule = new TestSchedule();
        resource = new IntegrityResource();
        resource.validationService = schedule.validator;
        resource.formatter = new ValidationReportFormatter();
    }

    @Test
    void reportIsReturnedWith200EvenWhenInvalid() {
        schedule.eveningLineUp();
        schedule.corruption.putIntervalRecord("Ghost Show", 2);

        Response response = resource.getReport();

        assertThat(response.getStatus()).isEqualTo(200);
        ValidationReportDTO report = (ValidationReportDTO) response.getEntity();
        assertThat(report.overallValid()).isFalse();
        assertThat(report.summary().totalErrors()).isEqualTo(1);
    }

    @Test
    void textReportMatchesFormatter() {
        schedule.eveningLineUp();

        Response response = resource.getTextReport();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat((String) response.getEntity())
                .isEqualTo(resource.formatter.format(schedule.validator.runValidation()))
                .contains("Overall Status: PASS");
    }

    @Test
    void storageFailurePropagatesToExceptionMapper() {
        IntegrityValidationService failing = mock(IntegrityValidationService.class);
        when(failing.runValidation())
                .thenThrow(new StorageFailureException("validation aborted", new IllegalStateException()));
        resource.validationService = failing;

        assertThatThrownBy(resource::getReport).isInstanceOf(StorageFailureException.class);
    }
}
