package com.minicall.calling.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

/**
 * 群通话响铃子状态：仅在响铃尚未被“加入”消化时存在。
 *
 * @param ringId   响铃唯一 id（取消/拒绝时必须精确匹配）。64 位随机数，按字符串下发，避免 JS Number 精度丢失
 * @param ringerId 发起响铃的成员 id
 */
public record RingState(@JsonSerialize(using = ToStringSerializer.class) long ringId, String ringerId) {
}
