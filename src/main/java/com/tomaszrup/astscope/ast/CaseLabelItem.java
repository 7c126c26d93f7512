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
 * One pattern of a {@code case} label, with its optional {@code where} guard.
 */
public class CaseLabelItem {
	private final Pattern pattern;
	private final Expr guardExpr;

	public CaseLabelItem(Pattern pattern, Expr guardExpr) {
		this.pattern = pattern;
		this.guardExpr = guardExpr;
	}

	public Pattern getPattern() {
		return pattern;
	}

	public Expr getGuardExpr() {
		return guardExpr;
	}
}
