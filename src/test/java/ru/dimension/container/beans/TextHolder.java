package ru.dimension.container.beans;

public class TextHolder {

  public final String text;

  public TextHolder(String text) {
    this.text = text;
  }
}
