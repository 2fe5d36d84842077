package com.ethnicthv.dyneq.processor;

import com.ethnicthv.dyneq.processor.decl.DeclarationParser;
import com.ethnicthv.dyneq.processor.decl.ExpansionException;
import com.ethnicthv.dyneq.processor.decl.TraitObjectDecl;
import com.google.auto.service.AutoService;

import javax.annotation.processing.*;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import java.io.IOException;
import java.util.*;

/**
 * Expands {@code @DynEqObject} declarations into {@code <Interface>Equality} classes and checks
 * the equality contract of every {@code DynEq} implementer in the compilation.
 */
// "*": the contract check covers every DynEq implementer, annotated or not
@SupportedAnnotationTypes("*")
@SupportedOptions({
        ProcessorOptions.VERBOSE,
        ProcessorOptions.BOXES,
        ProcessorOptions.HASH_CODE_CHECK
})
@AutoService(Processor.class)
public class DynEqProcessor extends BaseProcessor {
    // ---------------------------------------------------------------------
    // Constants
    // ---------------------------------------------------------------------
    private static final String ANNO_DYN_EQ_OBJECT = "com.ethnicthv.dyneq.core.annotation.DynEqObject";
    private static final String ANNO_DYN_EQ_OBJECT_LIST = "com.ethnicthv.dyneq.core.annotation.DynEqObject.List";

    // Interfaces already expanded in this compilation (FQN -> declaring site)
    private final Map<String, Element> expanded = new LinkedHashMap<>();

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        note("DynEqProcessor init: %s", options);
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        TypeElement dynEq = getTypeElement(EqualityContractChecker.DYN_EQ);
        if (dynEq == null) {
            // dyneq-core not on the classpath: nothing in this compilation can use DynEq
            return false;
        }
        checkContracts(dynEq, roundEnv);

        DeclarationResolver resolver = new DeclarationResolver(elementUtils, typeUtils, dynEq);
        for (Map.Entry<Element, List<AnnotationMirror>> site : collectDeclarations(roundEnv).entrySet()) {
            for (AnnotationMirror am : site.getValue()) {
                expand(resolver, site.getKey(), am);
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Sealing
    // ---------------------------------------------------------------------
    private void checkContracts(TypeElement dynEq, RoundEnvironment roundEnv) {
        EqualityContractChecker checker = new EqualityContractChecker(typeUtils, dynEq, options.hashCodeCheck(),
                new EqualityContractChecker.Sink() {
                    @Override
                    public void error(Element e, String fmt, Object... args) {
                        DynEqProcessor.this.error(e, fmt, args);
                    }

                    @Override
                    public void warn(Element e, String fmt, Object... args) {
                        DynEqProcessor.this.warn(e, fmt, args);
                    }
                });
        for (Element root : roundEnv.getRootElements()) checker.check(root);
        note("Checked %d DynEq type(s)", checker.checkedCount());
    }

    // ---------------------------------------------------------------------
    // Declaration discovery
    // ---------------------------------------------------------------------
    private Map<Element, List<AnnotationMirror>> collectDeclarations(RoundEnvironment roundEnv) {
        Map<Element, List<AnnotationMirror>> out = new LinkedHashMap<>();
        TypeElement single = getTypeElement(ANNO_DYN_EQ_OBJECT);
        TypeElement container = getTypeElement(ANNO_DYN_EQ_OBJECT_LIST);
        if (single != null) {
            for (Element e : roundEnv.getElementsAnnotatedWith(single)) {
                out.computeIfAbsent(e, k -> new ArrayList<>()).add(getAnnotation(e, ANNO_DYN_EQ_OBJECT));
            }
        }
        if (container != null) {
            for (Element e : roundEnv.getElementsAnnotatedWith(container)) {
                out.computeIfAbsent(e, k -> new ArrayList<>())
                        .addAll(readAnnotationArray(getAnnotation(e, ANNO_DYN_EQ_OBJECT_LIST), "value"));
            }
        }
        note("Found %d @DynEqObject site(s)", out.size());
        return out;
    }

    // ---------------------------------------------------------------------
    // Expansion of one declaration
    // ---------------------------------------------------------------------
    private void expand(DeclarationResolver resolver, Element site, AnnotationMirror am) {
        String value = readString(am, "value", "").trim();
        boolean boxes = readBoolean(am, "boxes", true) && options.boxes();
        try {
            String text;
            if (value.isEmpty()) {
                if (site.getKind() != ElementKind.INTERFACE) {
                    throw new ExpansionException("@DynEqObject without a declaration must annotate an interface");
                }
                text = DeclarationResolver.deriveDeclaration((TypeElement) site);
            } else {
                text = value;
            }
            TraitObjectDecl parsed = DeclarationParser.parse(text);
            DeclarationResolver.Resolved resolved = resolver.resolve(parsed, site);
            String fqn = resolved.iface().getQualifiedName().toString();
            Element previous = expanded.putIfAbsent(fqn, site);
            if (previous != null) {
                throw new ExpansionException("duplicate @DynEqObject declaration for " + fqn + " (already declared on " + previous + ")");
            }
            String pkg = elementUtils.getPackageOf(resolved.iface()).getQualifiedName().toString();
            EqualitySourceWriter writer = new EqualitySourceWriter(pkg,
                    DeclarationResolver.equalityClassName(resolved.iface()), resolved.decl(), boxes);
            writer.write(processingEnv.getFiler(), site);
            note("Generated %s for %s (boxes=%s)", writer.qualifiedName(), resolved.decl().targetType(), boxes);
        } catch (ExpansionException ex) {
            error(site, am, "Invalid @DynEqObject declaration: %s", ex.getMessage());
        } catch (IOException ex) {
            error(site, am, "Failed to generate equality for %s: %s", site, ex.getMessage());
        }
    }
}
