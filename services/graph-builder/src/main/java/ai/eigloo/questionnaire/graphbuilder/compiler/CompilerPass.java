package ai.eigloo.questionnaire.graphbuilder.compiler;

/**
 * One rewriting step of the compiler. Passes run in a fixed order and mutate the graph held
 * by the context in place.
 */
public interface CompilerPass {

    String name();

    void apply(CompilationContext context);
}
