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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import org.eclipse.lsp4j.Range;

import com.tomaszrup.astscope.source.SourceManager;

/**
 * Dumps a scope subtree as JSON for debugging. Each scope becomes an object
 * with its kind, description, zero-based LSP range and children. Scopes
 * whose range is not cached get a {@code null} range.
 */
public final class ScopeTreeJsonWriter {
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

	private static final String KEY_KIND = "kind";
	private static final String KEY_DESCRIPTION = "description";
	private static final String KEY_RANGE = "range";
	private static final String KEY_CHILDREN = "children";

	private ScopeTreeJsonWriter() {
	}

	public static JsonObject toJson(ASTScopeImpl root) {
		return toJson(root, root.getSourceManager());
	}

	public static String write(ASTScopeImpl root) {
		return GSON.toJson(toJson(root));
	}

	private static JsonObject toJson(ASTScopeImpl scope, SourceManager sourceManager) {
		JsonObject json = new JsonObject();
		json.addProperty(KEY_KIND, scope.getClassName());
		String description = scope.getDescription();
		if (!description.isEmpty()) {
			json.addProperty(KEY_DESCRIPTION, description);
		}
		Range range = sourceManager.toLspRange(scope.getSourceRange(true));
		json.add(KEY_RANGE, range != null ? GSON.toJsonTree(range) : JsonNull.INSTANCE);
		JsonArray children = new JsonArray();
		for (ASTScopeImpl child : scope.getChildren()) {
			children.add(toJson(child, sourceManager));
		}
		json.add(KEY_CHILDREN, children);
		return json;
	}
}
