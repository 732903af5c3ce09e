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
package minic.frontend.tree;

/**
 * One method per AST node kind.
 *
 * @param <R> result of visiting a node
 * @param <E> checked exception the visitor may throw
 */
public interface NodeVisitor<R, E extends Exception> {
  R visitProgram(Program node) throws E;
  R visitMainFunction(MainFunction node) throws E;
  R visitVariableDeclaration(VariableDeclaration node) throws E;
  R visitAssignment(Assignment node) throws E;
  R visitReturn(Return node) throws E;
  R visitIntLiteral(IntLiteral node) throws E;
  R visitFloatLiteral(FloatLiteral node) throws E;
  R visitCharLiteral(CharLiteral node) throws E;
  R visitIdentifier(Identifier node) throws E;
  R visitUnaryOp(UnaryOp node) throws E;
  R visitBinaryOp(BinaryOp node) throws E;
  R visitDereference(Dereference node) throws E;
  R visitAddressOf(AddressOf node) throws E;
  R visitIncrement(Increment node) throws E;
  R visitDecrement(Decrement node) throws E;
  R visitCast(Cast node) throws E;
}
