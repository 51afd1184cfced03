package com.ammann.intervals.exception;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationExceptionTest
{

    @ParameterizedTest
    @CsvSource({
            "sort,title,'start' or no value",
            "start,25:00,a time in HH:MM format"
    })
    void buildsInvalidParameterMessage(String param, String value, String expectedFragment)
    {
        ValidationException ex = ValidationException.invalidParameter(param, value, expectedFragment);
        assertThat(ex.getMessage()).contains(param, value, expectedFragment);
    }

    @Test
    void blankNameMessage()
    {
        assertThat(InvalidProgramNameException.blank().getMessage())
                .isEqualTo("Program name must not be empty or blank");
    }

    @Test
    void tooLongNameMessageCarriesBothLengths()
    {
        InvalidProgramNameException ex = InvalidProgramNameException.tooLong(300, 255);

        assertThat(ex).isInstanceOf(ValidationException.class);
        assertThat(ex.getMessage()).isEqualTo("Program name exceeds maximum length (255 characters): got 300");
    }
}
