/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package minic.opt;

import org.apache.log4j.Logger;

import minic.common.exceptions.UserException;
import minic.frontend.tree.Program;

public interface OptimizerPass {
  /**
   * @return name of optimization pass for logging
   */
  public abstract String getPassName();

  /**
   * @return name of the setting that enables or disables this pass
   */
  public abstract String getConfigEnabledKey();

  /**
   * Optimize a whole program
   * @return the optimized program; the input is left unchanged
   */
  public abstract Program optimize(Logger logger, Program program)
                                              throws UserException;
}
