package io.cfgtypes.generator.builder;

import io.cfgtypes.generator.analysis.ConstructionShape;
import io.cfgtypes.generator.model.VariantRef;
import io.cfgtypes.parser.api.Identifier;
import java.util.List;

/**
 * Construction of a rule without an incremental builder: one constructor per variant, taking the
 * variant's capability sub-terms as already built values.
 */
public record CompositionContract(Identifier rule, List<Constructor> constructors)
    implements BuilderProtocol {

  /**
   * Builds one variant.
   *
   * @param name variant name
   * @param variant the alternative built
   * @param arguments one {@link StepArgument.SuppliedValue} per capability sub-term, in order
   */
  public record Constructor(String name, VariantRef variant, List<StepArgument> arguments) {
    public Constructor {
      arguments = List.copyOf(arguments);
    }
  }

  public CompositionContract {
    constructors = List.copyOf(constructors);
  }

  @Override
  public ConstructionShape shape() {
    return ConstructionShape.GENERAL;
  }
}
