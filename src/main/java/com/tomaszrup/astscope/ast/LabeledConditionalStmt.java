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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.astscope.source.SourceLoc;

/**
 * A statement guarded by a condition list: {@code if}, {@code while} or
 * {@code guard}.
 */
public abstract class LabeledConditionalStmt extends Stmt {
	private final List<StmtConditionElement> cond;

	protected LabeledConditionalStmt(SourceLoc startLoc, List<StmtConditionElement> cond, SourceLoc endLoc) {
		super(startLoc, endLoc);
		this.cond = new ArrayList<>(cond);
	}

	public List<StmtConditionElement> getCond() {
		return Collections.unmodifiableList(cond);
	}

	protected List<ASTNode> getConditionNodes() {
		List<ASTNode> nodes = new ArrayList<>();
		for (StmtConditionElement element : cond) {
			nodes.addAll(element.getNodes());
		}
		return nodes;
	}
}
