package io.intellixity.sqlbridge.resource;

public interface Describable {
  DescribeResult describe();
}
