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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

class ScopeTreeJsonWriterTests {

	@Test
	void testTreeIsWrittenWithLspRanges() {
		FunctionScopeTree tree = new FunctionScopeTree().cached();
		JsonObject json = ScopeTreeJsonWriter.toJson(tree.root);

		Assertions.assertEquals("ASTSourceFileScope", json.get("kind").getAsString());
		Assertions.assertEquals("'test.swift'", json.get("description").getAsString());

		JsonObject decl = json.getAsJsonArray("children").get(0).getAsJsonObject();
		Assertions.assertEquals("AbstractFunctionDeclScope", decl.get("kind").getAsString());
		Assertions.assertEquals("'fn'", decl.get("description").getAsString());
		JsonObject range = decl.getAsJsonObject("range");
		Assertions.assertEquals(0, range.getAsJsonObject("start").get("line").getAsInt());
		Assertions.assertEquals(7, range.getAsJsonObject("start").get("character").getAsInt());
		Assertions.assertEquals(23, range.getAsJsonObject("end").get("character").getAsInt());
	}

	@Test
	void testUncachedRangesAreNull() {
		FunctionScopeTree tree = new FunctionScopeTree();
		JsonObject json = ScopeTreeJsonWriter.toJson(tree.root);
		Assertions.assertTrue(json.get("range").isJsonNull());
	}

	@Test
	void testLeavesHaveEmptyChildren() {
		FunctionScopeTree tree = new FunctionScopeTree().cached();
		JsonObject json = ScopeTreeJsonWriter.toJson(tree.braceScope);
		Assertions.assertEquals(0, json.getAsJsonArray("children").size());
		Assertions.assertEquals("1 elements", json.get("description").getAsString());
	}

	@Test
	void testWriteProducesParsableJson() {
		FunctionScopeTree tree = new FunctionScopeTree().cached();
		String written = ScopeTreeJsonWriter.write(tree.root);
		JsonObject parsed = JsonParser.parseString(written).getAsJsonObject();
		JsonArray children = parsed.getAsJsonArray("children");
		Assertions.assertEquals(1, children.size());
	}
}
