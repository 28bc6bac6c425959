package com.codemigration.metagraph.extraction.parser;

import com.codemigration.metagraph.exception.MalformedInputException;
import com.codemigration.metagraph.extraction.ParsedSkeleton;
import com.codemigration.metagraph.extraction.SourceUnit;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.EnumInfo;
import com.codemigration.metagraph.model.entity.MethodRef;
import com.codemigration.metagraph.model.entity.ModuleRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Java Source Parser Tests")
class JavaSourceParserTest {

    private static final String PATH = "src/com/acme/billing/InvoiceService.java";

    private JavaSourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new JavaSourceParser();
    }

    @Test
    @DisplayName("Should extract singleton class, nested enum, imports and same-package references")
    void testParseService_ShouldExtractSkeleton() {
        // Given
        String source = """
            package com.acme.billing;

            import java.util.List;
            import com.acme.core.Money;

            /**
             * Computes invoices.
             */
            public class InvoiceService {
                private static final InvoiceService INSTANCE = new InvoiceService();
                private Customer customer;
                protected List<Money> lines;

                private InvoiceService() {
                }

                public static InvoiceService getInstance() {
                    return INSTANCE;
                }

                @Deprecated
                public Money total(List<Money> items) {
                    return null;
                }

                enum Status { OPEN, PAID }
            }
            """;

        // When
        ParsedSkeleton skeleton = parser.parse(new SourceUnit(PATH, "java", source));

        // Then
        assertTrue(skeleton.getFunctions().isEmpty(), "Java has no free functions");
        assertEquals(1, skeleton.getClasses().size());
        ClassInfo service = skeleton.getClasses().get(0);
        assertEquals(PATH + "::class:InvoiceService", service.getKey());
        assertEquals(ClassInfo.KIND_SINGLETON, service.getKind());
        assertEquals("Computes invoices.", service.getDocstring());
        assertEquals(List.of("INSTANCE", "customer", "lines"),
            service.getAttributes().stream().map(a -> a.getName()).toList());
        assertEquals("protected", service.getAttributes().get(2).getVisibility());

        MethodRef total = service.getMethods().stream()
            .filter(m -> m.getName().equals("total"))
            .findFirst()
            .orElseThrow(() -> new AssertionError("Should find total method"));
        assertEquals("Money", total.getReturnType());
        assertEquals(List.of("@Deprecated"), total.getDecorators());
        assertEquals("List<Money>", total.getArguments().get(0).getType());

        EnumInfo status = skeleton.getEnums().get(0);
        assertEquals("InvoiceService.Status", status.getName());
        assertEquals(List.of("OPEN", "PAID"), status.getValues());

        assertEquals(List.of("java.util.List", "com.acme.core.Money"),
            skeleton.getImports().stream().map(ModuleRef::getModule).toList());
        assertEquals(List.of("com/acme/core/Money.java"), skeleton.getImports().get(1).getCandidates());

        ModuleRef customer = skeleton.getReferences().stream()
            .filter(r -> r.getModule().equals("Customer"))
            .findFirst()
            .orElseThrow(() -> new AssertionError("Unimported type should be looked up next to the file"));
        assertEquals(List.of("src/com/acme/billing/Customer.java"), customer.getCandidates());
        assertTrue(skeleton.getReferences().stream().noneMatch(r -> r.getModule().equals("InvoiceService")),
            "Types declared in the file are not references");
    }

    @Test
    @DisplayName("Should tag interfaces, abstract classes and records")
    void testDeclarationKinds() {
        String source = """
            package com.acme;

            import java.util.*;

            public interface Repository<T> extends Iterable<T> {
                T find(String id);
            }

            abstract class Base {
            }

            record Line(String sku, int quantity) implements Comparable<Line> {
                public int compareTo(Line other) { return 0; }
            }
            """;

        ParsedSkeleton skeleton = parser.parse(new SourceUnit("Repository.java", "java", source));

        assertEquals(ClassInfo.KIND_INTERFACE, kindOf(skeleton, "Repository"));
        assertEquals(ClassInfo.KIND_ABSTRACT, kindOf(skeleton, "Base"));
        assertEquals("record", kindOf(skeleton, "Line"));

        ModuleRef wildcard = skeleton.getImports().get(0);
        assertEquals("java.util.*", wildcard.getModule());
        assertEquals(List.of("java/util/"), wildcard.getCandidates());
    }

    @Test
    @DisplayName("Should reject code that does not parse")
    void testSyntaxError_ShouldThrowMalformedInput() {
        String source = """
            public class {
                void x(
            }
            """;

        MalformedInputException error = assertThrows(MalformedInputException.class,
            () -> parser.parse(new SourceUnit("Broken.java", "java", source)));
        assertEquals("Broken.java", error.getPath());
    }

    private static String kindOf(ParsedSkeleton skeleton, String name) {
        return skeleton.getClasses().stream()
            .filter(c -> c.getName().equals(name))
            .map(ClassInfo::getKind)
            .findFirst()
            .orElseThrow(() -> new AssertionError("Should find " + name));
    }
}
