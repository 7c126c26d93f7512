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
 * {@code case .a(let x), .b(let x) where x > 0: body}. The body is modelled
 * as a brace statement without braces.
 */
public class CaseStmt extends Stmt {
	private final List<CaseLabelItem> caseLabelItems;
	private final BraceStmt body;

	public CaseStmt(SourceLoc caseLoc, List<CaseLabelItem> caseLabelItems, BraceStmt body) {
		super(caseLoc, body.getEndLoc());
		this.caseLabelItems = new ArrayList<>(caseLabelItems);
		this.body = body;
	}

	public List<CaseLabelItem> getCaseLabelItems() {
		return Collections.unmodifiableList(caseLabelItems);
	}

	public BraceStmt getBody() {
		return body;
	}

	@Override
	public List<ASTNode> getChildren() {
		List<ASTNode> children = new ArrayList<>();
		for (CaseLabelItem item : caseLabelItems) {
			children.addAll(childrenOf(item.getPattern(), item.getGuardExpr()));
		}
		children.add(body);
		return children;
	}
}
