/*
 * Copyright 2025 The Blockflow Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.blockflow.layers;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.HashMap;
import java.util.Map;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class SwitchTest {
  private final Program program = new Program();
  private final Block global = program.globalBlock();
  private final Layers layers = new Layers(program);
  private final Variable result = fp32("result");

  private Variable bool(String name) {
    return global.createVar(Variable.named(name).dataType(DataType.BOOL).shape(1));
  }

  private Variable fp32(String name) {
    return global.createVar(Variable.named(name).dataType(DataType.FP32).shape(1));
  }

  /**
   * Evaluates the boolean operations of {@code block} in order, given values for some of its
   * variables; returns the values of every variable computed.
   */
  private static Map<String, Boolean> evaluate(Block block, Map<String, Boolean> inputs) {
    Map<String, Boolean> env = new HashMap<>(inputs);
    for (Operation op : block.ops()) {
      String type = op.type();
      if (type.equals("logical_not")) {
        env.put(op.output("Out").get(0), !env.get(op.input("X").get(0)));
      } else if (type.equals("logical_and")) {
        env.put(
            op.output("Out").get(0),
            env.get(op.input("X").get(0)) && env.get(op.input("Y").get(0)));
      }
    }
    return env;
  }

  @Test
  public void guards(
      @TestParameter boolean v1, @TestParameter boolean v2, @TestParameter boolean v3) {
    Variable p1 = bool("p1");
    Variable p2 = bool("p2");
    Variable p3 = bool("p3");
    Switch sw = new Switch(program);
    sw.scope(
        () -> {
          sw.caseOf(p1, () -> layers.assign(fp32("a"), result));
          sw.caseOf(p2, () -> layers.assign(fp32("b"), result));
          sw.caseOf(p3, () -> layers.assign(fp32("c"), result));
          sw.defaultCase(() -> layers.assign(fp32("d"), result));
        });
    assertThat(sw.state()).isEqualTo(ConstructState.AFTER);
    ImmutableList<Variable> guards = sw.guards();
    assertThat(guards).hasSize(4);

    Map<String, Boolean> env = evaluate(global, ImmutableMap.of("p1", v1, "p2", v2, "p3", v3));
    assertThat(env.get(guards.get(0).name())).isEqualTo(v1);
    assertThat(env.get(guards.get(1).name())).isEqualTo(v2 && !v1);
    assertThat(env.get(guards.get(2).name())).isEqualTo(v3 && !v1 && !v2);
    assertThat(env.get(guards.get(3).name())).isEqualTo(!v1 && !v2 && !v3);
    // Exactly one branch runs
    assertThat(guards.stream().filter(g -> env.get(g.name())).count()).isEqualTo(1);

    ImmutableList<Operation> branches =
        global.ops().stream()
            .filter(op -> op.type().equals("conditional_block"))
            .collect(ImmutableList.toImmutableList());
    assertThat(branches).hasSize(4);
    for (int i = 0; i < 4; i++) {
      assertThat(branches.get(i).input("X")).containsExactly(guards.get(i).name());
      assertThat(branches.get(i).output("Out")).containsExactly("result");
    }
  }

  @Test
  public void defaultNeedsACase() {
    Switch sw = new Switch(program);
    BuildError e =
        assertThrows(
            BuildError.class,
            () -> sw.scope(() -> sw.defaultCase(() -> layers.assign(fp32("d"), result))));
    assertThat(e.kind).isEqualTo(BuildError.Kind.SEQUENCING);
  }

  @Test
  public void caseOutsideScope() {
    Variable p1 = bool("p1");
    Switch sw = new Switch(program);
    BuildError before =
        assertThrows(BuildError.class, () -> sw.caseOf(p1, () -> layers.assign(p1, p1)));
    assertThat(before.kind).isEqualTo(BuildError.Kind.SEQUENCING);

    Switch sw2 = new Switch(program);
    sw2.scope(() -> sw2.caseOf(p1, () -> layers.assign(fp32("a"), result)));
    BuildError after =
        assertThrows(BuildError.class, () -> sw2.defaultCase(() -> layers.assign(p1, p1)));
    assertThat(after.kind).isEqualTo(BuildError.Kind.SEQUENCING);
  }

  @Test
  public void failedCaseRemovesEveryBranch() {
    Variable p1 = bool("p1");
    Variable p2 = bool("p2");
    Variable one = fp32("one");
    int numOps = global.ops().size();
    int numVars = global.vars().size();
    Switch sw = new Switch(program);
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () ->
                sw.scope(
                    () -> {
                      sw.caseOf(p1, () -> layers.assign(one, result));
                      sw.caseOf(
                          p2,
                          () -> {
                            layers.assign(one, result);
                            throw new IllegalStateException("boom");
                          });
                    }));
    assertThat(e).hasMessageThat().isEqualTo("boom");
    // The guards and the committed first case are gone too
    assertThat(global.ops()).hasSize(numOps);
    assertThat(global.vars()).hasSize(numVars);
    assertThat(program.numBlocks()).isEqualTo(1);
    assertThat(program.current()).isSameInstanceAs(global);
    BuildError again = assertThrows(BuildError.class, () -> sw.scope(() -> {}));
    assertThat(again.kind).isEqualTo(BuildError.Kind.SEQUENCING);
  }
}
