////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.astscope.ast;

/**
 * Callback interface for {@link ASTNode#walk(ASTWalker)}. Every method
 * returns whether the walk should descend into the node's children.
 */
public interface ASTWalker {
	default boolean walkToDeclPre(Decl decl) {
		return true;
	}

	default boolean walkToStmtPre(Stmt stmt) {
		return true;
	}

	default boolean walkToExprPre(Expr expr) {
		return true;
	}

	default boolean walkToPatternPre(Pattern pattern) {
		return true;
	}
}
