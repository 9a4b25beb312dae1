package net.findmyaisle.support.parsing;

import net.findmyaisle.model.RecordKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecordFieldTest {

    @Test
    void isAbsent_recognizesPlaceholdersAndNotAvailable() {
        assertThat(RecordField.WEBSITE.isAbsent("n/a")).isTrue();
        assertThat(RecordField.IMAGE_URL.isAbsent(" " + RecordField.IMAGE_URL.placeholder())).isTrue();
        assertThat(RecordField.PRICE.isAbsent("  ")).isTrue();
        assertThat(RecordField.PRICE.isAbsent("N/A")).isFalse();
        assertThat(RecordField.BRAND.isAbsent("Silk")).isFalse();
    }

    @Test
    void matchLine_onlyConsidersFieldsOfTheRequestedKind() {
        assertThat(RecordField.matchLine(RecordKind.PRODUCT, "BRAND: Silk")).contains(RecordField.BRAND);
        assertThat(RecordField.matchLine(RecordKind.STORE, "BRAND: Silk")).isEmpty();
        assertThat(RecordField.matchLine(RecordKind.STORE, "STATUS: open")).contains(RecordField.STATUS);
    }

    @Test
    void fieldsFor_listsFieldsInTemplateOrder() {
        assertThat(RecordField.fieldsFor(RecordKind.STORE)).containsExactly(
            RecordField.STORE, RecordField.ADDRESS, RecordField.SERVICES, RecordField.WEBSITE, RecordField.STATUS);
        assertThat(RecordField.primaryFor(RecordKind.PRODUCT)).isEqualTo(RecordField.PRODUCT);
    }
}
