/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.cellcalc.api.expressions.proto;

import com.google.common.base.Preconditions;
import dev.cellcalc.api.Coordinate;
import dev.cellcalc.api.Expression;
import dev.cellcalc.api.Value;
import dev.cellcalc.api.expressions.*;
import dev.cellcalc.proto.ExprProtos;
import java.util.List;

public final class ExpressionProtoDeserializer {
    private ExpressionProtoDeserializer() {}

    public static Expression deserialize(ExprProtos.Expr expr) {
        switch (expr.getKind().getKindCase()) {
            case LITERAL:
                return deserializeLiteral(expr.getKind().getLiteral(), expr.getChildrenList());
            case BINARY_OP:
                return deserializeBinaryOp(expr.getKind().getBinaryOp(), expr.getChildrenList());
            case CELL_REFERENCE:
                return deserializeCellReference(expr.getKind().getCellReference(), expr.getChildrenList());
            default:
                throw new UnsupportedOperationException("Unsupported expression type encountered: "
                        + expr.getKind().getKindCase());
        }
    }

    private static Expression deserializeBinaryOp(ExprProtos.Kind.BinaryOp binaryOp, List<ExprProtos.Expr> children) {
        Preconditions.checkArgument(
                children.size() == 2, "BinaryOp %s expects 2 children, found %s", binaryOp, children.size());
        Expression left = deserialize(children.get(0));
        Expression right = deserialize(children.get(1));
        switch (binaryOp) {
            case Add:
                return Binary.add(left, right);
            case Subtract:
                return Binary.subtract(left, right);
            case Multiply:
                return Binary.multiply(left, right);
            case Divide:
                return Binary.divide(left, right);
            case Remainder:
                return Binary.remainder(left, right);
            case Power:
                return Binary.power(left, right);
            default:
                throw new UnsupportedOperationException("Unsupported BinaryOp encountered: " + binaryOp);
        }
    }

    private static Expression deserializeLiteral(ExprProtos.Kind.Literal literal, List<ExprProtos.Expr> children) {
        Preconditions.checkArgument(children.isEmpty(), "Literal expects no children, found %s", children.size());
        ExprProtos.ScalarValue scalarValue = literal.getValue();

        switch (scalarValue.getKindCase()) {
            case F64_VALUE:
                return Literal.of(Value.float64(scalarValue.getF64Value()));
            default:
                throw new UnsupportedOperationException("Unsupported ScalarValue type encountered: " + scalarValue);
        }
    }

    private static Expression deserializeCellReference(
            ExprProtos.Kind.CellReference cellReference, List<ExprProtos.Expr> children) {
        Preconditions.checkArgument(
                children.isEmpty(), "CellReference expects no children, found %s", children.size());
        ExprProtos.Coordinate coordinate = cellReference.getCoordinate();
        return CellReference.of(Coordinate.of(coordinate.getRow(), coordinate.getCol()));
    }
}
