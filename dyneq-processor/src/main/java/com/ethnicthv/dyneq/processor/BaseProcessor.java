package com.ethnicthv.dyneq.processor;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.*;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import java.util.*;

/**
 * Base annotation processor: diagnostics, configuration and annotation mirror utilities.
 */
public abstract class BaseProcessor extends AbstractProcessor {
    protected Elements elementUtils;
    protected Types typeUtils;
    protected ProcessorOptions options = ProcessorOptions.DEFAULTS;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.elementUtils = processingEnv.getElementUtils();
        this.typeUtils = processingEnv.getTypeUtils();
        this.options = ProcessorOptions.parse(processingEnv.getOptions(), this::warn);
    }

    // ---------------------------------------------------------------------
    // Messaging helpers
    // ---------------------------------------------------------------------
    protected void error(Element e, AnnotationMirror am, String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                String.format(Locale.ROOT, fmt, args), e, am);
    }
    protected void error(Element e, String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                String.format(Locale.ROOT, fmt, args), e);
    }
    protected void warn(String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.WARNING,
                String.format(Locale.ROOT, fmt, args));
    }
    protected void warn(Element e, String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.WARNING,
                String.format(Locale.ROOT, fmt, args), e);
    }
    protected void note(String fmt, Object... args) {
        if (!options.verbose()) return;
        processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                String.format(Locale.ROOT, fmt, args));
    }

    // ---------------------------------------------------------------------
    // Element helpers
    // ---------------------------------------------------------------------
    protected TypeElement getTypeElement(String fqn) {
        return elementUtils.getTypeElement(fqn);
    }

    // ---------------------------------------------------------------------
    // Annotation mirror utilities (static for easy import)
    // ---------------------------------------------------------------------
    public static AnnotationMirror getAnnotation(Element e, String fqn) {
        for (AnnotationMirror am : e.getAnnotationMirrors()) {
            if (((TypeElement) am.getAnnotationType().asElement()).getQualifiedName().contentEquals(fqn)) return am;
        }
        return null;
    }
    public static String readString(AnnotationMirror am, String name, String def) {
        if (am == null) return def;
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> e : am.getElementValues().entrySet()) {
            if (e.getKey().getSimpleName().contentEquals(name)) return String.valueOf(e.getValue().getValue());
        }
        return def;
    }
    public static boolean readBoolean(AnnotationMirror am, String name, boolean def) {
        if (am == null) return def;
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> e : am.getElementValues().entrySet()) {
            if (e.getKey().getSimpleName().contentEquals(name) && e.getValue().getValue() instanceof Boolean b) return b;
        }
        return def;
    }
    public static List<AnnotationMirror> readAnnotationArray(AnnotationMirror am, String name) {
        List<AnnotationMirror> out = new ArrayList<>();
        if (am == null) return out;
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> e : am.getElementValues().entrySet()) {
            if (!e.getKey().getSimpleName().contentEquals(name)) continue;
            Object v = e.getValue().getValue();
            if (v instanceof List<?> list) {
                for (Object o : list) {
                    if (((AnnotationValue) o).getValue() instanceof AnnotationMirror nested) out.add(nested);
                }
            }
        }
        return out;
    }
}
