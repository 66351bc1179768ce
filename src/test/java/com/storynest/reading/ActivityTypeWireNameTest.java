package com.storynest.reading;

import com.storynest.reading.domain.DomainModels.ActivityType;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ActivityTypeWireNameTest {

    @Test
    void wireNamesIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("exercise", ActivityType.EXERCISE.wireName());
            assertEquals("quiz", ActivityType.QUIZ.wireName());
            assertEquals("creative", ActivityType.CREATIVE.wireName());
            assertEquals(ActivityType.QUIZ, ActivityType.fromWire("quiz"));
            assertEquals(ActivityType.CREATIVE, ActivityType.fromWire(" creative "));
            for (ActivityType type : ActivityType.values()) {
                assertEquals(type, ActivityType.fromWire(type.wireName()));
            }
        } finally {
            Locale.setDefault(previous);
        }
    }
}
