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
package com.tomaszrup.astscope.scope;

import com.tomaszrup.astscope.ast.ExtensionDecl;
import com.tomaszrup.astscope.ast.GenericContextDecl;
import com.tomaszrup.astscope.ast.NominalTypeDecl;
import com.tomaszrup.astscope.ast.TrailingWhereClause;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * One portion of a nominal type or extension declaration. A type is split
 * into the whole declaration, its trailing {@code where} clause and its
 * member body so that generic parameters and requirements become visible in
 * the right places.
 */
public class GenericTypeOrExtensionScope extends ASTScopeImpl {

	public enum Portion {
		WHOLE {
			@Override
			SourceRange getChildlessSourceRangeOf(GenericContextDecl decl) {
				SourceRange r = decl.getSourceRangeIncludingAttrs();
				if (r.getStart().isValid()) {
					return r;
				}
				return decl.getSourceRange();
			}
		},
		WHERE {
			@Override
			SourceRange getChildlessSourceRangeOf(GenericContextDecl decl) {
				TrailingWhereClause where = decl.getTrailingWhereClause();
				if (where == null) {
					throw new IllegalStateException("where portion of a declaration without a where clause");
				}
				return where.getSourceRange();
			}
		},
		BODY {
			@Override
			SourceRange getChildlessSourceRangeOf(GenericContextDecl decl) {
				if (decl instanceof NominalTypeDecl) {
					return ((NominalTypeDecl) decl).getBraces();
				}
				if (decl instanceof ExtensionDecl) {
					return ((ExtensionDecl) decl).getBraces();
				}
				throw new IllegalStateException("No body in " + decl.getClass().getSimpleName());
			}
		};

		abstract SourceRange getChildlessSourceRangeOf(GenericContextDecl decl);
	}

	private final GenericContextDecl decl;
	private final Portion portion;

	public GenericTypeOrExtensionScope(GenericContextDecl decl, Portion portion) {
		this.decl = decl;
		this.portion = portion;
	}

	public GenericContextDecl getDecl() {
		return decl;
	}

	public Portion getPortion() {
		return portion;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		return portion.getChildlessSourceRangeOf(decl);
	}

	@Override
	public String getDescription() {
		String name = decl instanceof NominalTypeDecl ? ((NominalTypeDecl) decl).getName()
				: decl instanceof ExtensionDecl ? ((ExtensionDecl) decl).getExtendedTypeName() : "";
		return portion.name().toLowerCase() + " '" + name + "'";
	}
}
