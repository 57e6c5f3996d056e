package com.devision.corsgateway.template;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TemplateValidatorTest {

    @Mock
    private TemplateStore store;

    @Mock
    private PermissionRegistry registry;

    private TemplateValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TemplateValidator(store, registry);
    }

    @Test
    void returnsDeclaredTemplate() {
        RequestTemplate template = new RequestTemplate("getTest", "GET", "http", "localhost:8000", "/api/test", null, null);
        when(store.get("getTest")).thenReturn(Optional.of(template));
        when(registry.isDeclared("getTest")).thenReturn(true);

        assertThat(validator.validate("getTest")).isSameAs(template);
    }

    @Test
    void unknownTemplateIsNotFoundEvenIfDeclared() {
        when(store.get("ghost")).thenReturn(Optional.empty());
        when(registry.isDeclared("ghost")).thenReturn(true);

        assertThatThrownBy(() -> validator.validate("ghost"))
                .hasMessage("Template \"ghost\" not found in request templates")
                .isInstanceOfSatisfying(TemplateNotFoundException.class,
                        e -> assertThat(e.getKind()).isEqualTo(InvocationErrorKind.TEMPLATE_NOT_FOUND));
    }

    @Test
    void undeclaredTemplateIsRejected() {
        when(store.get("deleteEverything"))
                .thenReturn(Optional.of(new RequestTemplate("deleteEverything", "DELETE", null, "h", "/", null, null)));
        when(registry.isDeclared("deleteEverything")).thenReturn(false);

        assertThatThrownBy(() -> validator.validate("deleteEverything"))
                .isInstanceOf(TemplateNotDeclaredException.class)
                .hasMessage("Template \"deleteEverything\" not declared in manifest.json");
    }

    @Test
    void missingMethodOrHostIsMalformed() {
        when(store.get("noMethod")).thenReturn(Optional.of(new RequestTemplate("noMethod", " ", null, "h", "/", null, null)));
        when(store.get("noHost")).thenReturn(Optional.of(new RequestTemplate("noHost", "GET", null, null, "/", null, null)));
        when(registry.isDeclared("noMethod")).thenReturn(true);
        when(registry.isDeclared("noHost")).thenReturn(true);

        assertThatThrownBy(() -> validator.validate("noMethod"))
                .isInstanceOf(TemplateMalformedException.class)
                .hasMessage("Template \"noMethod\" missing required field: method");
        assertThatThrownBy(() -> validator.validate("noHost"))
                .isInstanceOf(TemplateMalformedException.class)
                .hasMessage("Template \"noHost\" missing required field: host");
    }

    @Test
    void listingIntersectsStoreAndManifest() {
        when(store.names()).thenReturn(List.of("createTicket", "deleteEverything", "getTest"));
        when(registry.declaredNames()).thenReturn(List.of("createTicket", "getTest", "notConfigured"));
        when(registry.isDeclared("createTicket")).thenReturn(true);
        when(registry.isDeclared("getTest")).thenReturn(true);

        TemplateListing listing = validator.listing();

        assertThat(listing.valid()).containsExactly("createTicket", "getTest");
        assertThat(listing.configured()).hasSize(3);
        assertThat(listing.declared()).contains("notConfigured");
    }
}
